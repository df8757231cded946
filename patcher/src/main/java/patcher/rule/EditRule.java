package patcher.rule;

/**
 * One idempotent structural edit.
 *
 * <p>A rule locates its target span, checks whether the span already satisfies
 * the rule's postcondition and, if not, rewrites the span. Applying a rule to
 * content it has already been applied to returns that content unchanged.
 * A missing target span is not an error: the rule leaves the content as is.
 *
 * @see patcher.plan.PatchPlan
 * @see patcher.engine.FileRewriter
 */
public interface EditRule {

    /** Returns the kind of construct this rule edits. */
    TargetKind kind();

    /** Returns the construct identifier, e.g. a type or function name. */
    String identifier();

    /**
     * Applies the rule to the given content.
     *
     * @param content the current file content
     * @return the outcome, with {@code changed == false} if nothing was rewritten
     */
    RuleOutcome apply(String content);

    /** Returns the rule id, {@code <kind label>:<identifier>}. */
    default String id() {
        return kind().label() + ":" + identifier();
    }
}
