package patcher.rule;

import patcher.locate.Span;
import patcher.locate.StructuralLocator;

import java.util.List;
import java.util.Objects;

/**
 * Replaces a placeholder marker comment with a concrete statement.
 *
 * <p>Every occurrence of the two-line pattern (marker line immediately followed
 * by the fallback line) becomes the replacement statement followed by the
 * original fallback line, each keeping its own indentation. Once no marker is
 * followed by the fallback, the rule is satisfied.
 */
public final class PlaceholderRule implements EditRule {

    private final String marker;
    private final String fallback;
    private final String replacement;

    /**
     * @param marker the marker comment line, e.g. {@code // TODO: log error}
     * @param fallback the statement that follows the marker
     * @param replacement the statement that takes the marker's place
     */
    public PlaceholderRule(String marker, String fallback, String replacement) {
        this.marker = Objects.requireNonNull(marker, "marker").trim();
        this.fallback = Objects.requireNonNull(fallback, "fallback").trim();
        this.replacement = Objects.requireNonNull(replacement, "replacement").trim();
    }

    @Override
    public TargetKind kind() {
        return TargetKind.PLACEHOLDER_STATEMENT;
    }

    @Override
    public String identifier() {
        return marker;
    }

    @Override
    public RuleOutcome apply(String content) {
        List<Span> spans = StructuralLocator.placeholders(content, marker, fallback);
        if (spans.isEmpty()) {
            return RuleOutcome.unchanged(content);
        }

        String result = content;
        // last to first so earlier offsets stay valid
        for (int i = spans.size() - 1; i >= 0; i--) {
            Span span = spans.get(i);
            String text = span.text(result);
            int newline = text.indexOf('\n');
            String markerIndent = ListAppender.indentOfLastLine(text.substring(0, newline));
            String fallbackIndent = ListAppender.indentOfLastLine(text.substring(newline + 1));
            result = span.replaceIn(result,
                    markerIndent + replacement + "\n" + fallbackIndent + fallback);
        }
        return RuleOutcome.of(content, result);
    }

    @Override
    public String toString() {
        return "PlaceholderRule{" + marker + " -> " + replacement + "}";
    }
}
