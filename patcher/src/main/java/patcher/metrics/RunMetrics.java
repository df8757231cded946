package patcher.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable metrics collected during one patch run.
 *
 * <p>Captures timing (total and per phase) and counts (files scanned,
 * files changed, edits applied). Use {@link #summary()} for a one-line
 * human-readable form, or {@link #toMap()} for structured output.
 *
 * @see RunMetricsCollector
 */
public record RunMetrics(
        long runId,
        Instant startTime,
        Instant endTime,
        Map<Phase, Long> phaseDurations,
        long totalDurationMs,
        int filesScanned,
        int filesChanged,
        int editsApplied
) {
    /**
     * Run phases for timing breakdown.
     */
    public enum Phase {
        /** Expanding the file pattern into paths */
        RESOLVE,
        /** Reading files and applying rules in memory */
        TRANSFORM,
        /** Writing changed files back */
        WRITE_BACK
    }

    public RunMetrics {
        phaseDurations = phaseDurations.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(phaseDurations));
    }

    /** Returns the total run duration as a Duration object. */
    public Duration totalDuration() {
        return Duration.ofMillis(totalDurationMs);
    }

    /**
     * Returns the duration of a specific phase.
     *
     * @param phase the phase to query
     * @return duration in milliseconds, or 0 if phase not recorded
     */
    public long phaseDuration(Phase phase) {
        return phaseDurations.getOrDefault(phase, 0L);
    }

    /** Returns the number of scanned files left unchanged. */
    public int filesUnchanged() {
        return filesScanned - filesChanged;
    }

    /**
     * Returns a human-readable summary of the run metrics.
     *
     * @return a formatted summary string
     */
    public String summary() {
        return String.format(Locale.ROOT,
                "Patch run #%d in %dms | Files: %d scanned, %d changed | Edits: %d | Phases: resolve=%dms transform=%dms write=%dms",
                runId, totalDurationMs, filesScanned, filesChanged, editsApplied,
                phaseDuration(Phase.RESOLVE), phaseDuration(Phase.TRANSFORM), phaseDuration(Phase.WRITE_BACK));
    }

    /**
     * Converts the metrics to an ordered map for structured output.
     *
     * @return a map of metric names to values
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("runId", runId);
        map.put("startTime", startTime.toString());
        map.put("endTime", endTime.toString());
        map.put("totalDurationMs", totalDurationMs);
        map.put("filesScanned", filesScanned);
        map.put("filesChanged", filesChanged);
        map.put("editsApplied", editsApplied);

        Map<String, Long> phases = new LinkedHashMap<>();
        for (Phase phase : Phase.values()) {
            phases.put(phase.name(), phaseDuration(phase));
        }
        map.put("phaseDurations", phases);
        return map;
    }
}
