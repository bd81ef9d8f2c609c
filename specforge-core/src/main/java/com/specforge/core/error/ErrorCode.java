package com.specforge.core.error;

/**
 * Machine-readable failure codes with remediation guidance.
 *
 * <p>Every {@link SpecForgeException} carries one of these codes so callers can branch on
 * the failure category without parsing messages, and so the command surface can print a
 * concrete next step for the user.
 *
 * @since 1.0.0
 */
public enum ErrorCode {

    PARSE_FRONT_MATTER("parse.front-matter",
        "Fix the YAML syntax between the '---' delimiters at the top of the specification."),
    PARSE_BLOCK("parse.block",
        "Fix the JSON syntax of the fenced block; it was dropped from the parsed specification."),

    PHASE_INVALID("phase.invalid",
        "Give the phase a non-blank kebab-case name, a non-null outputs list and register its dependencies first."),
    PHASE_FAILED("phase.failed",
        "Inspect the run log, fix the cause and re-run the pipeline to resume at the failed phase."),
    PHASE_DEPENDENCY_FAILED("phase.dependency-failed",
        "Fix the failed upstream phase; dependent phases run automatically on resume."),

    PATCH_CONTEXT_MISMATCH("patch.context-mismatch",
        "Regenerate the diff against the current file contents; no file was modified."),
    PATCH_MALFORMED("patch.malformed",
        "Provide a standard unified diff with '---', '+++' and '@@ -l,c +l,c @@' headers."),
    PATCH_TARGET("patch.target",
        "Check that the diff paths exist under the patch root and do not escape it."),
    PATCH_ENCODING("patch.encoding",
        "Only UTF-8 text files can be patched; convert the file to UTF-8 or edit it by hand."),
    PATCH_IO("patch.io",
        "Check file permissions and free disk space under the patch root."),

    PROVIDER_TRANSIENT("provider.transient",
        "The AI provider is temporarily unavailable; re-run later or configure a fallback provider."),
    PROVIDER_TIMEOUT("provider.timeout",
        "Raise ai.phaseTimeoutMs or reduce the prompt size."),
    PROVIDER_FATAL("provider.fatal",
        "Check the AI provider credentials and request parameters; retrying will not help."),

    RUN_STATE_IO("run-state.io",
        "Check that the runs directory is writable."),
    RUN_STATE_INVALID("run-state.invalid",
        "The run document is corrupt or from an unsupported schema version; start a fresh run."),
    RUN_NOT_FOUND("run-state.not-found",
        "List existing runs and pass a valid run id."),

    PIPELINE_ABORTED("pipeline.aborted",
        "The run was cancelled between phases; re-run the pipeline to resume.");

    private final String code;
    private final String remediation;

    ErrorCode(String code, String remediation) {
        this.code = code;
        this.remediation = remediation;
    }

    /**
     * Returns the stable, machine-readable code (e.g. {@code patch.context-mismatch}).
     *
     * @return code string
     */
    public String code() {
        return code;
    }

    /**
     * Returns human-readable guidance on how to recover from this failure.
     *
     * @return remediation hint
     */
    public String remediation() {
        return remediation;
    }
}
