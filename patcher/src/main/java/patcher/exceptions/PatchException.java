package patcher.exceptions;

import java.nio.file.Path;

/**
 * Exception thrown when a patch run cannot proceed.
 *
 * <p>Carries optional diagnostic context folded into {@link #getMessage()}:
 * <ul>
 *   <li>The file being processed when the failure occurred</li>
 *   <li>The identifier of the rule involved, if any</li>
 *   <li>The stage of the run ({@code plan}, {@code resolve}, {@code read}, {@code write}, {@code commit})</li>
 * </ul>
 *
 * <p>Absent structural matches never raise this exception; it is reserved
 * for invalid plans and filesystem failures, which abort the whole run.
 *
 * @see patcher.engine.PatchEngine
 * @see patcher.plan.PatchPlan#build(java.util.List)
 */
public class PatchException extends Exception {

    private final Path path;
    private final String ruleId;
    private final String stage;

    // ---------------- constructors ----------------

    /**
     * Creates a new patch exception with a message.
     *
     * @param message the error message
     */
    public PatchException(String message) {
        super(message);
        this.path = null;
        this.ruleId = null;
        this.stage = null;
    }

    /**
     * Creates a new patch exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public PatchException(String message, Throwable cause) {
        super(message, cause);
        this.path = null;
        this.ruleId = null;
        this.stage = null;
    }

    /**
     * Creates a new patch exception with full diagnostic context and cause.
     *
     * @param message the error message
     * @param path the file being processed (may be null)
     * @param ruleId the identifier of the rule involved (may be null)
     * @param stage the run stage where the failure occurred
     * @param cause the underlying cause (may be null)
     */
    public PatchException(String message,
                          Path path,
                          String ruleId,
                          String stage,
                          Throwable cause) {
        super(message, cause);
        this.path = path;
        this.ruleId = ruleId;
        this.stage = stage;
    }

    // ---------------- getters ----------------

    /** Returns the file involved in the failure, or null if not set. */
    public Path getPath() {
        return path;
    }

    /** Returns the identifier of the rule involved, or null if not set. */
    public String getRuleId() {
        return ruleId;
    }

    /** Returns the stage where the failure occurred, or null if not set. */
    public String getStage() {
        return stage;
    }

    // ---------------- diagnostics ----------------

    @Override
    public String getMessage() {
        String base = super.getMessage();
        StringBuilder sb = new StringBuilder(base);

        if (stage != null) sb.append(" [stage=").append(stage).append("]");
        if (path != null) sb.append(" [path=").append(path).append("]");
        if (ruleId != null) sb.append(" [rule=").append(ruleId).append("]");

        return sb.toString();
    }
}
