package com.specforge.core.pipeline;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Options for one pipeline invocation.
 *
 * @param baseDir directory holding run directories
 * @param workDir project directory that generated tests and patches are written under
 * @param skipFlags phase groups to skip
 * @param fromStep first phase to execute; earlier pending phases are skipped
 * @param stopAfter phase after which the run stops with status {@code stopped}
 * @param dryRun mark every remaining phase skipped without running it
 * @param resume continue the latest unfinished run of the same specification
 * @param runId explicit id for a new run, or {@code null} to generate one
 * @param cancellation abort signal checked before each phase
 */
public record PipelineOptions(
    Path baseDir,
    Path workDir,
    Set<SkipFlag> skipFlags,
    String fromStep,
    String stopAfter,
    boolean dryRun,
    boolean resume,
    String runId,
    CancellationToken cancellation
) {
    /**
     * Compact constructor with validation.
     */
    public PipelineOptions {
        Objects.requireNonNull(baseDir, "baseDir must not be null");
        if (workDir == null) {
            workDir = Path.of("").toAbsolutePath();
        }
        skipFlags = skipFlags == null || skipFlags.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(skipFlags));
        if (cancellation == null) {
            cancellation = new CancellationToken();
        }
    }

    public static Builder builder(Path baseDir) {
        return new Builder(baseDir);
    }

    /**
     * Builder for constructing PipelineOptions incrementally.
     */
    public static class Builder {
        private final Path baseDir;
        private Path workDir;
        private final Set<SkipFlag> skipFlags = EnumSet.noneOf(SkipFlag.class);
        private String fromStep;
        private String stopAfter;
        private boolean dryRun;
        private boolean resume = true;
        private String runId;
        private CancellationToken cancellation;

        public Builder(Path baseDir) {
            this.baseDir = baseDir;
        }

        public Builder workDir(Path dir) {
            this.workDir = dir;
            return this;
        }

        public Builder skip(SkipFlag flag) {
            skipFlags.add(flag);
            return this;
        }

        public Builder skip(Set<SkipFlag> flags) {
            skipFlags.addAll(flags);
            return this;
        }

        public Builder fromStep(String phase) {
            this.fromStep = phase;
            return this;
        }

        public Builder stopAfter(String phase) {
            this.stopAfter = phase;
            return this;
        }

        public Builder dryRun(boolean value) {
            this.dryRun = value;
            return this;
        }

        public Builder resume(boolean value) {
            this.resume = value;
            return this;
        }

        public Builder runId(String id) {
            this.runId = id;
            return this;
        }

        public Builder cancellation(CancellationToken token) {
            this.cancellation = token;
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(baseDir, workDir, skipFlags, fromStep, stopAfter, dryRun, resume, runId,
                cancellation);
        }
    }
}
