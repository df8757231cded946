package patcher.report;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Prints the user-facing run report.
 *
 * <pre>
 * ✓ Updated services/fx-service/cmd/fx/main.go
 * - No changes needed: services/card-service/cmd/card/main.go
 *
 * Total: 1 files updated
 * </pre>
 *
 * Paths are printed relative to the run root.
 */
public final class RunReporter {

    private final PrintStream out;
    private final Path root;
    private final boolean reportUnchanged;
    private final boolean dryRun;

    public RunReporter(PrintStream out, Path root, boolean reportUnchanged, boolean dryRun) {
        this.out = Objects.requireNonNull(out, "out");
        this.root = Objects.requireNonNull(root, "root");
        this.reportUnchanged = reportUnchanged;
        this.dryRun = dryRun;
    }

    /** Prints the line for one file. Unchanged files are skipped unless configured otherwise. */
    public void fileResult(FileVerdict verdict) {
        String path = display(verdict.path());
        if (verdict.changed()) {
            out.println((dryRun ? "~ Would update " : "✓ Updated ") + path);
        } else if (reportUnchanged) {
            out.println("- No changes needed: " + path);
        }
    }

    /** Prints the trailing total line. */
    public void total(RunSummary summary) {
        out.println();
        if (summary.dryRun()) {
            out.println("Total: " + summary.changedCount() + " files would be updated");
        } else {
            out.println("Total: " + summary.changedCount() + " files updated");
        }
    }

    private String display(Path path) {
        Path shown = path.startsWith(root) ? root.relativize(path) : path;
        return shown.toString().replace('\\', '/');
    }
}
