package com.specforge.core.pipeline;

/**
 * Caller-supplied switches that turn off groups of phases.
 */
public enum SkipFlag {
    /** Skip the AI review of the specification. */
    REVIEW,
    /** Skip AI test generation and the project test run. */
    TESTS,
    /** Skip AI implementation and patch application. */
    IMPLEMENTATION
}
