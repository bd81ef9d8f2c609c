package com.specforge;

import com.specforge.cli.AnalyzeCommand;
import com.specforge.cli.ApplyPatchCommand;
import com.specforge.cli.RunCommand;
import com.specforge.cli.RunsCommand;
import com.specforge.cli.StatusCommand;
import com.specforge.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for SpecForge.
 *
 * <p>SpecForge validates feature specifications against quality gates, assesses their scope
 * and drives them through a resumable pipeline of phases that ends with a verified patch.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Run the quality gates against a specification</li>
 *   <li>{@code analyze} - Assess whether a specification should be split</li>
 *   <li>{@code run} - Run or resume the pipeline for a specification</li>
 *   <li>{@code status} - Show progress of the latest run of a specification</li>
 *   <li>{@code runs} - List runs</li>
 *   <li>{@code apply-patch} - Verify and apply a unified diff</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Validate a specification
 * specforge validate specs/feature.md
 *
 * # Run the pipeline without AI phases
 * specforge run specs/feature.md --skip-review --skip-tests --skip-implementation
 *
 * # Run the project's tests after patching, with up to two fix attempts
 * specforge run specs/feature.md --test-command "mvn -B test" --max-fix-iterations 2
 *
 * # Check progress
 * specforge status specs/feature.md
 * }</pre>
 */
@Command(
    name = "specforge",
    mixinStandardHelpOptions = true,
    version = "SpecForge 1.0.0-SNAPSHOT",
    description = "Specification validation and resumable spec-to-code pipeline",
    subcommands = {
        ValidateCommand.class,
        AnalyzeCommand.class,
        RunCommand.class,
        StatusCommand.class,
        RunsCommand.class,
        ApplyPatchCommand.class
    }
)
public class SpecForgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SpecForgeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("SpecForge - Specification validation and spec-to-code pipeline");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'specforge --help' to see available commands");
        System.out.println("Use 'specforge <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with global options applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        SpecForgeCLI cli = new SpecForgeCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
