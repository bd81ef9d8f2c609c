package com.specforge.cli;

import com.specforge.core.config.ConfigLoader;
import com.specforge.core.config.SpecForgeConfig;
import com.specforge.core.error.PatchRejectedException;
import com.specforge.core.patch.PatchApplier;
import com.specforge.core.patch.PatchOptions;
import com.specforge.core.patch.PatchResult;
import com.specforge.core.util.FileUtils;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to verify and apply a unified diff.
 *
 * <p>Every context and removed line must match exactly; a rejected file is left untouched.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * specforge apply-patch fix.patch --root src
 * specforge apply-patch fix.patch --check
 * }</pre>
 */
@Command(
    name = "apply-patch",
    description = "Verify and apply a unified diff",
    mixinStandardHelpOptions = true
)
public class ApplyPatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ApplyPatchCommand.class);

    @Parameters(index = "0", description = "Diff file")
    private Path diffFile;

    @Option(names = {"-r", "--root"}, description = "Directory the diff paths resolve against (default: .)")
    private Path rootDir = Paths.get(".");

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: specforge.yaml)")
    private Path configPath = Paths.get(SpecForgeConfig.DEFAULT_FILE);

    @Option(names = {"--check"}, description = "Verify only; do not write any file")
    private boolean checkOnly;

    @Option(names = {"--per-file"}, description = "Apply files independently instead of all-or-nothing")
    private boolean perFile;

    @Override
    public Integer call() {
        boolean atomic = !perFile && ConfigLoader.load(configPath).patch().crossFileAtomic();
        PatchApplier applier = new PatchApplier(new PatchOptions(rootDir, atomic));
        try {
            String diff = FileUtils.readString(diffFile);
            PatchResult result = checkOnly ? applier.check(diff) : applier.applyPatch(diff);
            String verb = checkOnly ? "Would change " : "Changed ";
            System.out.println("✓ " + verb + result.filesChanged().size() + " file(s)");
            result.modified().forEach(file -> System.out.println("  M " + file));
            result.created().forEach(file -> System.out.println("  A " + file));
            result.deleted().forEach(file -> System.out.println("  D " + file));
            return 0;
        } catch (IOException e) {
            System.err.println("✗ Cannot read " + diffFile + ": " + e.getMessage());
            return 2;
        } catch (PatchRejectedException e) {
            log.debug("Patch rejected", e);
            System.err.println("✗ Patch rejected [" + e.getErrorCode().code() + "]: " + e.getMessage());
            if (!e.getAppliedFiles().isEmpty()) {
                System.err.println("  Already applied: " + e.getAppliedFiles());
            }
            System.err.println("  " + e.getRemediation());
            return 1;
        }
    }
}
