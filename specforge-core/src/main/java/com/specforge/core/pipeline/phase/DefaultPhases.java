package com.specforge.core.pipeline.phase;

import com.specforge.core.ai.AiGateway;
import com.specforge.core.pipeline.PhaseRegistry;

import java.util.List;

/**
 * The built-in pipeline: validate, review, analyze, generate-tests, implement, patch, run-tests, finalize.
 */
public final class DefaultPhases {

    public static final List<String> NAMES = List.of(
        ValidatePhase.NAME, ReviewPhase.NAME, AnalyzePhase.NAME, GenerateTestsPhase.NAME,
        ImplementPhase.NAME, PatchPhase.NAME, RunTestsPhase.NAME, FinalizePhase.NAME);

    private DefaultPhases() {
        // Utility class
    }

    /**
     * Creates a registry holding the built-in phases, with no test command configured.
     *
     * @param ai gateway used by review, test generation and implementation
     * @param crossFileAtomic whether the patch phase applies multi-file diffs all-or-nothing
     * @return populated registry
     */
    public static PhaseRegistry create(AiGateway ai, boolean crossFileAtomic) {
        return create(ai, crossFileAtomic, RunTestsPhase.Settings.disabled());
    }

    /**
     * Creates a registry holding the built-in phases in execution order.
     *
     * @param ai gateway used by review, test generation, implementation and test fixing
     * @param crossFileAtomic whether the patch phase applies multi-file diffs all-or-nothing
     * @param tests test command and fix-loop settings
     * @return populated registry
     */
    public static PhaseRegistry create(AiGateway ai, boolean crossFileAtomic, RunTestsPhase.Settings tests) {
        return new PhaseRegistry()
            .register(new ValidatePhase())
            .register(new ReviewPhase(ai))
            .register(new AnalyzePhase())
            .register(new GenerateTestsPhase(ai))
            .register(new ImplementPhase(ai))
            .register(new PatchPhase(crossFileAtomic))
            .register(new RunTestsPhase(ai, tests))
            .register(new FinalizePhase());
    }
}
