package com.specforge.cli;

import com.specforge.core.config.ConfigLoader;
import com.specforge.core.config.SpecForgeConfig;
import com.specforge.core.error.SpecForgeException;
import com.specforge.core.pipeline.PipelineStatus;
import com.specforge.core.runstate.RunStateStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to show progress of the latest run of a specification.
 */
@Command(
    name = "status",
    description = "Show progress of the latest run of a specification",
    mixinStandardHelpOptions = true
)
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Specification file")
    private Path specFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: specforge.yaml)")
    private Path configPath = Paths.get(SpecForgeConfig.DEFAULT_FILE);

    @Option(names = {"--runs-dir"}, description = "Directory holding runs (overrides config)")
    private Path runsDir;

    @Override
    public Integer call() {
        Path baseDir = runsDir != null ? runsDir : ConfigLoader.load(configPath).runs().baseDirPath();
        try {
            Optional<PipelineStatus> status = new RunStateStore().findLatestRunForSpec(baseDir, specFile)
                .map(PipelineStatus::of);
            if (status.isEmpty()) {
                System.out.println("No runs found for " + specFile.toAbsolutePath() + " in " + baseDir);
                return 1;
            }
            print(status.get());
            return 0;
        } catch (SpecForgeException e) {
            System.err.println("✗ " + e.getMessage());
            return 2;
        }
    }

    static void print(PipelineStatus status) {
        System.out.println("Run:       " + status.runId() + " (" + status.status().value() + ")");
        System.out.println("Directory: " + status.runDir());
        if (status.currentPhase() != null) {
            System.out.println("Current:   " + status.currentPhase());
        }
        status.completed().forEach(phase -> System.out.println("  ✓ " + phase));
        status.failed().forEach(phase -> System.out.println("  ✗ " + phase));
        status.skipped().forEach(phase -> System.out.println("  - " + phase + " (skipped)"));
        status.pending().forEach(phase -> System.out.println("  ○ " + phase));
    }
}
