package patcher.alert;

import patcher.config.AlertLevel;
import patcher.metrics.RunMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Structured logging for patch run events.
 *
 * <p>Log entries use markers like RUN_STARTED, FILE_UPDATED, RUN_FAILED
 * with key=value pairs for easy parsing and alerting.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs all events (run lifecycle, per-file updates, skipped spans)</li>
 *   <li>WARNING: logs unbalanced spans and errors only</li>
 *   <li>ERROR: logs errors only</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * [main] INFO patch - RUN_STARTED id=3 root=/src pattern=services/*&#47;cmd/*&#47;main.go
 * [main] INFO patch - FILE_UPDATED id=3 path=services/fx/cmd/fx/main.go edits=1
 * [main] WARN patch - SPAN_UNBALANCED rule=field:FXHandler offset=412
 * [main] INFO patch - RUN_COMPLETED id=3 duration_ms=18 files_scanned=9 files_changed=4
 * </pre>
 */
public final class PatchAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("patch");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private PatchAlertLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level (DEBUG, WARNING, or ERROR)
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    /** Get the current alert level. */
    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    /**
     * Log when a run starts.
     *
     * @param runId the unique run identifier
     * @param root the run root directory
     * @param pattern the file pattern
     */
    public static void runStarted(long runId, Path root, String pattern) {
        if (shouldLogInfo()) {
            log.info("RUN_STARTED id={} root={} pattern={}", runId, root, pattern);
        }
    }

    /**
     * Log when a file has been rewritten (or would be, in a dry run).
     *
     * @param runId the run identifier
     * @param path the file path
     * @param edits number of rules that changed the file
     */
    public static void fileUpdated(long runId, Path path, int edits) {
        if (shouldLogInfo()) {
            log.info("FILE_UPDATED id={} path={} edits={}", runId, path, edits);
        }
    }

    /**
     * Log when a rule finds no target span in a file.
     *
     * @param ruleId the rule identifier
     */
    public static void spanAbsent(String ruleId) {
        if (shouldLogInfo()) {
            log.info("SPAN_ABSENT rule={}", ruleId);
        }
    }

    /**
     * Log when an opening delimiter has no matching close. The span is treated as absent.
     *
     * @param ruleId the rule identifier
     * @param offset character offset of the unmatched opener
     */
    public static void spanUnbalanced(String ruleId, int offset) {
        if (shouldLogWarn()) {
            log.warn("SPAN_UNBALANCED rule={} offset={}", ruleId, offset);
        }
    }

    /**
     * Log when a run completes.
     *
     * @param metrics the final run metrics
     */
    public static void runCompleted(RunMetrics metrics) {
        if (shouldLogInfo()) {
            log.info("RUN_COMPLETED id={} duration_ms={} files_scanned={} files_changed={} edits={}",
                    metrics.runId(),
                    metrics.totalDurationMs(),
                    metrics.filesScanned(),
                    metrics.filesChanged(),
                    metrics.editsApplied());
        }
    }

    /**
     * Log when a run fails. Always logged.
     *
     * @param runId the run identifier
     * @param error the error that aborted the run
     * @param filesWritten files already written before the failure
     */
    public static void runFailed(long runId, Throwable error, int filesWritten) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        log.error("RUN_FAILED id={} error=\"{}\" files_written={}", runId, errorMsg, filesWritten);
    }
}
