package com.specforge.core.testrun;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A test command to run in a project directory.
 *
 * @param arguments program and arguments, executed without a shell
 * @param workingDir directory the command runs in
 * @param timeout time allowed before the process is killed
 */
public record TestCommand(
    List<String> arguments,
    Path workingDir,
    Duration timeout
) {
    /**
     * Compact constructor with validation.
     */
    public TestCommand {
        Objects.requireNonNull(arguments, "arguments must not be null");
        Objects.requireNonNull(workingDir, "workingDir must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("arguments must not be empty");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        arguments = List.copyOf(arguments);
    }

    /**
     * Splits a command line on whitespace. Quoting is not interpreted.
     *
     * @param commandLine e.g. {@code mvn -B -q test}
     * @param workingDir directory the command runs in
     * @param timeout time allowed
     * @return command
     */
    public static TestCommand parse(String commandLine, Path workingDir, Duration timeout) {
        Objects.requireNonNull(commandLine, "commandLine must not be null");
        List<String> arguments = Arrays.stream(commandLine.trim().split("\\s+"))
            .filter(part -> !part.isEmpty())
            .toList();
        return new TestCommand(arguments, workingDir, timeout);
    }

    @Override
    public String toString() {
        return String.join(" ", arguments);
    }
}
