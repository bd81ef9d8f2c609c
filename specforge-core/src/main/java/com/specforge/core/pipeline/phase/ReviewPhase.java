package com.specforge.core.pipeline.phase;

import com.specforge.core.ai.AiGateway;
import com.specforge.core.ai.GenerationResult;
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

/**
 * Adversarial AI review of the specification, written to {@code artifacts/review.md}.
 *
 * <p>Not run for EASY specifications below maturity 3, or when review is skipped.
 */
public class ReviewPhase implements Phase {

    public static final String NAME = "review";
    public static final String REVIEW_FILE = "review.md";

    static final String SYSTEM_PROMPT = """
        You are a senior reviewer of feature specifications. Identify ambiguities, missing \
        edge cases, security gaps, untestable requirements and contradictions. Answer in \
        Markdown with one section per finding category and a final verdict line: \
        'Verdict: APPROVE' or 'Verdict: REVISE'.""";

    private final AiGateway ai;

    public ReviewPhase(AiGateway ai) {
        this.ai = ai;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> outputs() {
        return List.of("review_path", "verdict", "tokens");
    }

    @Override
    public List<String> dependsOn() {
        return List.of(ValidatePhase.NAME);
    }

    @Override
    public PhaseApplicabilityStrategy applicability() {
        return PhaseApplicabilityStrategies.notSkipped(SkipFlag.REVIEW)
            .and(PhaseApplicabilityStrategies.easyBelowMaturity(3).negate());
    }

    @Override
    public PhaseResult run(PhaseContext context) throws IOException {
        GenerationResult result = ai.generate(NAME, SYSTEM_PROMPT,
            "Review this specification:\n\n" + context.spec().raw());
        Path reviewPath = context.artifact(REVIEW_FILE);
        FileUtils.writeAtomically(reviewPath, result.content());
        return PhaseResult.success(Map.of(
            "review_path", reviewPath.toString(),
            "verdict", verdict(result.content()),
            "tokens", String.valueOf(result.tokens())));
    }

    static String verdict(String review) {
        if (review.contains("Verdict: REVISE")) {
            return "revise";
        }
        return review.contains("Verdict: APPROVE") ? "approve" : "unknown";
    }
}
