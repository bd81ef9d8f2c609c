package com.specforge.core.testrun;

import java.time.Duration;
import java.util.List;

/**
 * Result of running a test command.
 *
 * @param exitCode process exit code, {@code -1} when the process was killed on timeout
 * @param timedOut whether the timeout elapsed before the process exited
 * @param output combined standard output and error
 * @param failures failing tests recognized in the output
 * @param elapsed wall-clock duration
 */
public record TestRunOutcome(
    int exitCode,
    boolean timedOut,
    String output,
    List<TestFailure> failures,
    Duration elapsed
) {
    /**
     * Compact constructor with validation.
     */
    public TestRunOutcome {
        output = output == null ? "" : output;
        failures = failures == null ? List.of() : List.copyOf(failures);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public boolean passed() {
        return !timedOut && exitCode == 0;
    }

    /**
     * Returns a one-line description for logs and phase messages.
     *
     * @return summary
     */
    public String summary() {
        if (timedOut) {
            return "timed out after " + elapsed.toMillis() + "ms";
        }
        if (passed()) {
            return "passed";
        }
        return "exit code " + exitCode + ", " + failures.size() + " recognized failure(s)";
    }
}
