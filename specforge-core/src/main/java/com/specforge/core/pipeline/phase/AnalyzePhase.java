package com.specforge.core.pipeline.phase;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.specforge.core.pipeline.Phase;
import com.specforge.core.pipeline.PhaseContext;
import com.specforge.core.pipeline.PhaseResult;
import com.specforge.core.scope.ScopeAnalyzer;
import com.specforge.core.scope.ScopeAssessment;
import com.specforge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Records the scope assessment in {@code artifacts/scope.json}.
 *
 * <p>Advisory only: a recommendation to split never fails the phase.
 */
public class AnalyzePhase implements Phase {

    private static final Logger log = LoggerFactory.getLogger(AnalyzePhase.class);

    public static final String NAME = "analyze";
    public static final String SCOPE_FILE = "scope.json";

    private final ScopeAnalyzer analyzer;
    private final ObjectMapper objectMapper;

    public AnalyzePhase() {
        this(new ScopeAnalyzer(), new ObjectMapper());
    }

    public AnalyzePhase(ScopeAnalyzer analyzer, ObjectMapper objectMapper) {
        this.analyzer = analyzer;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> outputs() {
        return List.of("scope_report", "should_split", "split_score");
    }

    @Override
    public List<String> dependsOn() {
        return List.of(ValidatePhase.NAME);
    }

    @Override
    public PhaseResult run(PhaseContext context) throws IOException {
        ScopeAssessment assessment = analyzer.analyzeSpec(context.spec());
        if (assessment.shouldSplit()) {
            log.warn("Specification {} looks too large (score {}); consider splitting it",
                context.spec().specId(), assessment.score());
        }
        Path reportPath = context.artifact(SCOPE_FILE);
        FileUtils.writeAtomically(reportPath, objectMapper.writeValueAsBytes(assessment));
        return PhaseResult.success(Map.of(
            "scope_report", reportPath.toString(),
            "should_split", String.valueOf(assessment.shouldSplit()),
            "split_score", String.valueOf(assessment.score())));
    }
}
