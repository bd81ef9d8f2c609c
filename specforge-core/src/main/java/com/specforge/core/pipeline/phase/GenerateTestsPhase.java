package com.specforge.core.pipeline.phase;

import com.specforge.core.ai.AiGateway;
import com.specforge.core.ai.GenerationResult;
import com.specforge.core.model.DeterministicTest;
import com.specforge.core.model.FunctionalRequirement;
import com.specforge.core.model.Specification;
import com.specforge.core.pipeline.Phase;
import com.specforge.core.pipeline.PhaseApplicabilityStrategies;
import com.specforge.core.pipeline.PhaseApplicabilityStrategy;
import com.specforge.core.pipeline.PhaseContext;
import com.specforge.core.pipeline.PhaseResult;
import com.specforge.core.pipeline.SkipFlag;
import com.specforge.core.util.FileUtils;
import com.specforge.core.util.Slugs;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Generates tests from the requirements, acceptance criteria and deterministic tests.
 *
 * <p>Output is written under {@code <workDir>/tests/generated/}, named after the slug of the
 * specification id so that an id such as {@code ../../x} cannot leave that directory.
 */
public class GenerateTestsPhase implements Phase {

    public static final String NAME = "generate-tests";
    public static final String OUTPUT_DIR = "tests/generated";

    static final String SYSTEM_PROMPT = """
        You write automated tests from feature specifications. Produce one test per \
        acceptance criterion and one per deterministic test, asserting the exact expected \
        output. Reference the requirement id in each test name. Output only code.""";

    private final AiGateway ai;

    public GenerateTestsPhase(AiGateway ai) {
        this.ai = ai;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> outputs() {
        return List.of("tests_path");
    }

    @Override
    public List<String> dependsOn() {
        return List.of(ValidatePhase.NAME);
    }

    @Override
    public PhaseApplicabilityStrategy applicability() {
        return PhaseApplicabilityStrategies.notSkipped(SkipFlag.TESTS);
    }

    @Override
    public PhaseResult run(PhaseContext context) throws IOException {
        Specification spec = context.spec();
        GenerationResult result = ai.generate(NAME, SYSTEM_PROMPT, userPrompt(spec));
        Path testsPath = testsPath(context.options().workDir(), spec);
        FileUtils.writeAtomically(testsPath, result.content());
        return PhaseResult.success(Map.of("tests_path", testsPath.toString()));
    }

    static Path testsPath(Path workDir, Specification spec) {
        String slug = Slugs.slugify(spec.specId());
        return workDir.resolve(OUTPUT_DIR).resolve((slug.isEmpty() ? "spec" : slug) + ".generated.txt");
    }

    static String userPrompt(Specification spec) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Specification: ").append(spec.specId()).append("\n\n## Functional requirements\n");
        for (FunctionalRequirement requirement : spec.functionalRequirements()) {
            prompt.append("- ").append(requirement.id()).append(": ").append(requirement.description()).append('\n');
            requirement.validationCriteria().forEach(criterion -> prompt.append("  - ").append(criterion).append('\n'));
        }
        prompt.append("\n## Acceptance criteria\n");
        spec.acceptanceCriteria().forEach(criterion -> prompt.append("- ").append(criterion).append('\n'));
        if (!spec.deterministicTests().isEmpty()) {
            prompt.append("\n## Deterministic tests\n");
            for (DeterministicTest test : spec.deterministicTests()) {
                prompt.append("- ").append(test.id())
                    .append(": input ").append(test.input())
                    .append(" expected ").append(test.expected()).append('\n');
            }
        }
        return prompt.toString();
    }
}
