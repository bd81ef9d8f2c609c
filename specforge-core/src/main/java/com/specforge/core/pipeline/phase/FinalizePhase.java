package com.specforge.core.pipeline.phase;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
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
 * Writes {@code artifacts/summary.json}: the specification and every earlier phase's outputs.
 */
public class FinalizePhase implements Phase {

    public static final String NAME = "finalize";
    public static final String SUMMARY_FILE = "summary.json";

    private final ObjectMapper objectMapper;

    public FinalizePhase() {
        this(new ObjectMapper());
    }

    public FinalizePhase(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> outputs() {
        return List.of("summary_path");
    }

    @Override
    public PhaseResult run(PhaseContext context) throws IOException {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("run_id", context.runId());
        summary.put("spec_id", context.spec().specId());
        summary.put("spec_path", context.specPath().toString());
        summary.put("phases", context.priorOutputs());
        Path summaryPath = context.artifact(SUMMARY_FILE);
        FileUtils.writeAtomically(summaryPath, objectMapper.writeValueAsBytes(summary));
        return PhaseResult.success(Map.of("summary_path", summaryPath.toString()));
    }
}
