package patcher.metrics;

import patcher.metrics.RunMetrics.Phase;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Collects timing and counts during a patch run.
 *
 * <h2>Usage:</h2>
 * <pre>
 * RunMetricsCollector collector = new RunMetricsCollector();
 * collector.start(runId);
 *
 * List&lt;Path&gt; files = collector.timed(Phase.RESOLVE, () -&gt; resolver.resolve(root, pattern));
 * collector.filesScanned(files.size());
 *
 * RunMetrics metrics = collector.finish();
 * </pre>
 *
 * <p>Phase durations accumulate, so a phase timed once per file reports its total.
 *
 * @see RunMetrics
 */
public final class RunMetricsCollector {

    private final Map<Phase, Long> phaseDurations = new EnumMap<>(Phase.class);

    private long runId;
    private Instant startTime;
    private int filesScanned;
    private int filesChanged;
    private int editsApplied;

    /**
     * Starts metrics collection for a new run.
     *
     * @param runId the unique run identifier
     * @return this collector for method chaining
     */
    public RunMetricsCollector start(long runId) {
        this.runId = runId;
        this.startTime = Instant.now();
        this.phaseDurations.clear();
        this.filesScanned = 0;
        this.filesChanged = 0;
        this.editsApplied = 0;
        return this;
    }

    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E;
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    /**
     * Time a phase and run the action (can throw checked exceptions).
     */
    public <E extends Exception> void timed(Phase phase, ThrowingRunnable<E> action) throws E {
        long start = System.nanoTime();
        try {
            action.run();
        } finally {
            record(phase, start);
        }
    }

    /**
     * Time a phase and return the result (can throw checked exceptions).
     */
    public <T, E extends Exception> T timed(Phase phase, ThrowingSupplier<T, E> action) throws E {
        long start = System.nanoTime();
        try {
            return action.get();
        } finally {
            record(phase, start);
        }
    }

    /**
     * Records the number of files selected by the pattern.
     *
     * @param count the number of files
     * @return this collector for method chaining
     */
    public RunMetricsCollector filesScanned(int count) {
        this.filesScanned = count;
        return this;
    }

    /**
     * Records the outcome of one file.
     *
     * @param changed whether the file content changed
     * @param edits number of rules that changed the content
     * @return this collector for method chaining
     */
    public RunMetricsCollector fileProcessed(boolean changed, int edits) {
        if (changed) filesChanged++;
        editsApplied += edits;
        return this;
    }

    /**
     * Finishes metrics collection and returns the final metrics.
     *
     * @return the collected run metrics
     */
    public RunMetrics finish() {
        Instant endTime = Instant.now();
        return new RunMetrics(
                runId,
                startTime,
                endTime,
                phaseDurations,
                Duration.between(startTime, endTime).toMillis(),
                filesScanned,
                filesChanged,
                editsApplied);
    }

    private void record(Phase phase, long startNanos) {
        long elapsed = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        phaseDurations.merge(phase, elapsed, Long::sum);
    }
}
