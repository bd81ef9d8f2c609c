package com.specforge.core.pipeline.phase;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.specforge.core.error.ErrorCode;
import com.specforge.core.error.PhaseFailureException;
import com.specforge.core.gate.GateId;
import com.specforge.core.gate.GateResult;
import com.specforge.core.gate.GateValidator;
import com.specforge.core.gate.Violation;
import com.specforge.core.model.Specification;
import com.specforge.core.pipeline.Phase;
import com.specforge.core.pipeline.PhaseContext;
import com.specforge.core.pipeline.PhaseResult;
import com.specforge.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the quality gates and fails the run when the specification is not agent-ready.
 *
 * <p>The report ({@code artifacts/validation.json}) is written either way.
 */
public class ValidatePhase implements Phase {

    public static final String NAME = "validate";
    public static final String REPORT_FILE = "validation.json";

    private final GateValidator validator;
    private final ObjectMapper objectMapper;

    public ValidatePhase() {
        this(new GateValidator(), new ObjectMapper());
    }

    public ValidatePhase(GateValidator validator, ObjectMapper objectMapper) {
        this.validator = validator;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> outputs() {
        return List.of("validation_report", "readiness_score", "agent_ready");
    }

    @Override
    public PhaseResult run(PhaseContext context) throws IOException {
        Specification spec = context.spec();
        Map<GateId, GateResult> results = validator.runAllGates(spec);
        boolean agentReady = validator.isAgentReady(spec, results);
        int score = GateValidator.readinessScore(results);
        List<Violation> blocking = validator.blockingViolations(spec, results);

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("spec_id", spec.specId());
        report.put("agent_ready", agentReady);
        report.put("readiness_score", score);
        report.put("gates", results);
        report.put("parse_issues", spec.parseIssues());
        Path reportPath = context.artifact(REPORT_FILE);
        FileUtils.writeAtomically(reportPath, objectMapper.writeValueAsBytes(report));

        if (!agentReady) {
            String first = blocking.isEmpty() ? "complexity or maturity is missing" : blocking.get(0).message();
            throw new PhaseFailureException(ErrorCode.PHASE_FAILED, NAME,
                "Specification is not agent-ready (" + blocking.size() + " blocking violation(s)); first: " + first);
        }
        return PhaseResult.success(Map.of(
            "validation_report", reportPath.toString(),
            "readiness_score", String.valueOf(score),
            "agent_ready", "true"));
    }
}
