package com.specforge.core.pipeline.phase;

import com.specforge.core.error.ErrorCode;
import com.specforge.core.error.PhaseFailureException;
import com.specforge.core.patch.PatchApplier;
import com.specforge.core.patch.PatchOptions;
import com.specforge.core.patch.PatchResult;
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
import java.util.stream.Collectors;

/**
 * Applies the diff produced by {@link ImplementPhase} to the work directory.
 *
 * <p>A diff whose context does not match fails the phase with the applier's code and leaves
 * the rejected files untouched.
 */
public class PatchPhase implements Phase {

    public static final String NAME = "patch";

    private final boolean crossFileAtomic;

    public PatchPhase(boolean crossFileAtomic) {
        this.crossFileAtomic = crossFileAtomic;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> outputs() {
        return List.of("files_changed", "changed");
    }

    @Override
    public List<String> dependsOn() {
        return List.of(ImplementPhase.NAME);
    }

    @Override
    public PhaseApplicabilityStrategy applicability() {
        return PhaseApplicabilityStrategies.notSkipped(SkipFlag.IMPLEMENTATION);
    }

    @Override
    public PhaseResult run(PhaseContext context) throws IOException {
        String patchPath = context.output(ImplementPhase.NAME, ImplementPhase.PATCH_PATH)
            .orElseThrow(() -> new PhaseFailureException(ErrorCode.PHASE_DEPENDENCY_FAILED, NAME,
                "No implementation patch was recorded by phase '" + ImplementPhase.NAME + "'"));

        Path workDir = context.options().workDir();
        PatchResult result = PatchApplier.applyPatch(FileUtils.readString(Path.of(patchPath)),
            new PatchOptions(workDir, crossFileAtomic));
        String changed = result.filesChanged().stream()
            .map(file -> workDir.toAbsolutePath().normalize().relativize(file).toString())
            .collect(Collectors.joining(","));
        return PhaseResult.success(Map.of(
            "files_changed", String.valueOf(result.filesChanged().size()),
            "changed", changed));
    }
}
