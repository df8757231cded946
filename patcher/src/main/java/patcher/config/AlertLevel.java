package patcher.config;

/**
 * Alert level for patch run logging.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link patcher.alert.PatchAlertLogger}. This can be configured
 * via the {@code patch.alert.level} property.
 *
 * <p>Log output at each level:
 * <ul>
 *   <li>{@link #DEBUG} - All events: run started, per-file updates, skipped spans, run completed</li>
 *   <li>{@link #WARNING} - Unbalanced spans and errors only</li>
 *   <li>{@link #ERROR} - Errors only (run failed)</li>
 * </ul>
 *
 * @see PatchConfig#alertLevel()
 */
public enum AlertLevel {
    /** Log all events. Use for development and troubleshooting. */
    DEBUG,

    /** Log warnings and errors only. This is the default level. */
    WARNING,

    /** Log errors only. */
    ERROR
}
