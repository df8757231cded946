package patcher.rule;

/**
 * Result of applying one rule to a file's content.
 *
 * @param content the content after the rule (the input itself if unchanged)
 * @param changed true if the rule rewrote at least one span
 */
public record RuleOutcome(String content, boolean changed) {

    public static RuleOutcome unchanged(String content) {
        return new RuleOutcome(content, false);
    }

    /** Compares against the input so a rewrite that reproduces it counts as unchanged. */
    public static RuleOutcome of(String before, String after) {
        return new RuleOutcome(after, !after.equals(before));
    }
}
