package com.specforge.core.testrun;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs a {@link TestCommand} as a child process and captures its output to a file.
 *
 * <p>Standard error is merged into standard output so that runner messages keep their order.
 * A process still running at the timeout is killed and reported with {@code timedOut} set.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TestRunOutcome outcome = new TestCommandRunner().run(
 *     TestCommand.parse("mvn -B test", projectDir, Duration.ofMinutes(10)),
 *     runDir.resolve("artifacts/test-output.txt"));
 * }</pre>
 */
public class TestCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(TestCommandRunner.class);

    private static final long KILL_GRACE_SECONDS = 5;

    /**
     * Runs the command to completion or timeout.
     *
     * @param command command to run
     * @param outputFile file receiving the combined output; parent directories are created
     * @return outcome with output and recognized failures
     * @throws IOException if the process cannot be started or its output cannot be read
     */
    public TestRunOutcome run(TestCommand command, Path outputFile) throws IOException {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(outputFile, "outputFile must not be null");
        Files.createDirectories(outputFile.toAbsolutePath().getParent());

        log.info("Running tests: {} (in {})", command, command.workingDir());
        long started = System.nanoTime();
        Process process = new ProcessBuilder(command.arguments())
            .directory(command.workingDir().toFile())
            .redirectErrorStream(true)
            .redirectOutput(outputFile.toFile())
            .start();

        boolean finished;
        try {
            finished = process.waitFor(command.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly().waitFor(KILL_GRACE_SECONDS, TimeUnit.SECONDS);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while running " + command);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        String output = new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
        int exitCode = finished ? process.exitValue() : -1;
        TestRunOutcome outcome = new TestRunOutcome(exitCode, !finished, output,
            TestFailureParser.parse(output), elapsed);
        if (outcome.passed()) {
            log.info("Tests passed in {}ms", elapsed.toMillis());
        } else {
            log.warn("Tests failed: {}", outcome.summary());
        }
        return outcome;
    }
}
