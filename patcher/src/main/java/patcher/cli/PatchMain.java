package patcher.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import patcher.config.PatchConfig;
import patcher.config.PatchConfigLoader;
import patcher.engine.PatchEngine;
import patcher.report.FileVerdict;
import patcher.report.RunSummary;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Command-line entry point.
 *
 * <h2>Usage:</h2>
 * <pre>
 * java -cp patcher.jar patcher.cli.PatchMain [--config &lt;file&gt;] [--dry-run] &lt;root&gt;
 * </pre>
 *
 * <p>Without {@code --config}, configuration is loaded from {@code patch.properties}
 * or {@code patch.yml} on the classpath. The configured document patch, if any,
 * runs after the file set; a configuration with an empty catalog only patches
 * the document. Any failure propagates out of {@code main}.
 *
 * @see PatchConfigLoader
 * @see PatchEngine
 */
public final class PatchMain {

    private static final Logger log = LoggerFactory.getLogger(PatchMain.class);

    static final String USAGE = "Usage: PatchMain [--config <file>] [--dry-run] <root>";

    private PatchMain() {}

    public static void main(String[] args) throws Exception {
        int changed = run(args, System.out);
        log.debug("{} files changed", changed);
    }

    /**
     * Parses arguments and runs the configured patch.
     *
     * @param args command-line arguments
     * @param out the stream receiving the report
     * @return the number of files changed (or that would change, in a dry run)
     * @throws IllegalArgumentException on malformed arguments
     */
    static int run(String[] args, PrintStream out) throws Exception {
        Path configFile = null;
        Path root = null;
        boolean dryRun = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("--config needs a file\n" + USAGE);
                    }
                    configFile = Path.of(args[++i]);
                }
                case "--dry-run" -> dryRun = true;
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg + "\n" + USAGE);
                    }
                    if (root != null) {
                        throw new IllegalArgumentException("More than one root given\n" + USAGE);
                    }
                    root = Path.of(arg);
                }
            }
        }
        if (root == null) {
            throw new IllegalArgumentException(USAGE);
        }

        PatchConfig config = configFile != null
                ? PatchConfigLoader.loadFromFile(configFile)
                : PatchConfigLoader.load();
        if (dryRun) {
            config = config.withDryRun(true);
        }

        PatchEngine engine = PatchEngine.fromConfig(config).withOutput(out);
        int changed = 0;
        // a document-only configuration has no file set to walk
        if (!engine.getPlan().isEmpty()) {
            RunSummary summary = engine.run(root);
            changed += summary.changedCount();
        }
        Optional<FileVerdict> document = engine.runDocumentPatch(root);
        if (document.isPresent() && document.get().changed()) {
            changed++;
        }
        return changed;
    }
}
