package patcher.report;

import patcher.metrics.RunMetrics;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable summary of a completed run.
 *
 * <p>Only produced when every file of the run was processed; a failed run
 * yields an exception instead.
 *
 * @see RunReporter
 */
public final class RunSummary {

    private final List<FileVerdict> verdicts;
    private final RunMetrics metrics;
    private final boolean dryRun;

    public RunSummary(List<FileVerdict> verdicts, RunMetrics metrics, boolean dryRun) {
        this.verdicts = List.copyOf(verdicts);
        this.metrics = metrics;
        this.dryRun = dryRun;
    }

    /** Returns the verdict of every processed file, in processing order. */
    public List<FileVerdict> verdicts() { return verdicts; }

    /** Returns the run metrics. */
    public RunMetrics metrics() { return metrics; }

    /** Returns true if nothing was written. */
    public boolean dryRun() { return dryRun; }

    /** Returns the number of files whose content changed. */
    public int changedCount() {
        return (int) verdicts.stream().filter(FileVerdict::changed).count();
    }

    /** Returns the number of files left unchanged. */
    public int unchangedCount() {
        return verdicts.size() - changedCount();
    }

    /** Returns the paths of the changed files. */
    public List<Path> changedFiles() {
        return verdicts.stream().filter(FileVerdict::changed).map(FileVerdict::path).toList();
    }
}
