package com.specforge.core.pipeline.phase;

import com.specforge.core.ai.AiGateway;
import com.specforge.core.ai.GenerationResult;
import com.specforge.core.error.ErrorCode;
import com.specforge.core.error.PhaseFailureException;
import com.specforge.core.pipeline.Phase;
import com.specforge.core.pipeline.PhaseApplicabilityStrategies;
import com.specforge.core.pipeline.PhaseApplicabilityStrategy;
import com.specforge.core.pipeline.PhaseContext;
import com.specforge.core.pipeline.PhaseResult;
import com.specforge.core.pipeline.SkipFlag;
import com.specforge.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the AI provider for an implementation as a unified diff and saves it to
 * {@code artifacts/implementation.patch}. Nothing is applied here; see {@link PatchPhase}.
 */
public class ImplementPhase implements Phase {

    public static final String NAME = "implement";
    public static final String PATCH_FILE = "implementation.patch";
    public static final String PATCH_PATH = "patch_path";

    private static final Pattern FENCED_DIFF = Pattern.compile("```[\\w+-]*[ \\t]*\\n(.*?)```", Pattern.DOTALL);

    static final String SYSTEM_PROMPT = """
        You implement feature specifications. Reply with a single unified diff relative to \
        the project root, using '--- a/<path>' and '+++ b/<path>' headers and exact context \
        lines. Use '--- /dev/null' for new files. Do not include explanations.""";

    private final AiGateway ai;

    public ImplementPhase(AiGateway ai) {
        this.ai = ai;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> outputs() {
        return List.of(PATCH_PATH);
    }

    @Override
    public List<String> dependsOn() {
        return List.of(ValidatePhase.NAME);
    }

    @Override
    public PhaseApplicabilityStrategy applicability() {
        return PhaseApplicabilityStrategies.notSkipped(SkipFlag.IMPLEMENTATION);
    }

    @Override
    public PhaseResult run(PhaseContext context) throws IOException {
        StringBuilder prompt = new StringBuilder("Implement this specification:\n\n").append(context.spec().raw());
        context.output(GenerateTestsPhase.NAME, "tests_path")
            .ifPresent(tests -> prompt.append("\n\nGenerated tests to satisfy: ").append(tests));

        GenerationResult result = ai.generate(NAME, SYSTEM_PROMPT, prompt.toString());
        String diff = extractDiff(result.content());
        if (diff == null) {
            throw new PhaseFailureException(ErrorCode.PHASE_FAILED, NAME, "Provider response contains no unified diff");
        }
        Path patchPath = context.artifact(PATCH_FILE);
        FileUtils.writeAtomically(patchPath, diff);
        return PhaseResult.success(Map.of(PATCH_PATH, patchPath.toString()));
    }

    /**
     * Extracts a unified diff from a model response, fenced or bare.
     *
     * @param response model output
     * @return diff text, or null if the response has none
     */
    static String extractDiff(String response) {
        Matcher fenced = FENCED_DIFF.matcher(response);
        while (fenced.find()) {
            String block = fenced.group(1);
            if (looksLikeDiff(block)) {
                return block;
            }
        }
        return looksLikeDiff(response) ? response : null;
    }

    private static boolean looksLikeDiff(String text) {
        return (text.startsWith("--- ") || text.contains("\n--- ")) && text.contains("\n+++ ") && text.contains("@@");
    }
}
