package com.specforge.cli;

import com.specforge.core.config.ConfigLoader;
import com.specforge.core.config.SpecForgeConfig;
import com.specforge.core.runstate.RunState;
import com.specforge.core.runstate.RunStateStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to list runs, oldest first.
 */
@Command(
    name = "runs",
    description = "List pipeline runs",
    mixinStandardHelpOptions = true
)
public class RunsCommand implements Callable<Integer> {

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: specforge.yaml)")
    private Path configPath = Paths.get(SpecForgeConfig.DEFAULT_FILE);

    @Option(names = {"--runs-dir"}, description = "Directory holding runs (overrides config)")
    private Path runsDir;

    @Override
    public Integer call() {
        Path baseDir = runsDir != null ? runsDir : ConfigLoader.load(configPath).runs().baseDirPath();
        List<RunState> runs = new RunStateStore().listRunStates(baseDir);
        if (runs.isEmpty()) {
            System.out.println("No runs in " + baseDir);
            return 0;
        }
        for (RunState run : runs) {
            System.out.printf("%-26s %-12s %s  %s%n", run.runId(), run.status().value(), run.createdAt(), run.specPath());
        }
        return 0;
    }
}
