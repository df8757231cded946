package patcher.locate;

/**
 * Half-open character range {@code [start, end)} into a file's content.
 *
 * @param start index of the first character
 * @param end index one past the last character
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /** Returns the text covered by this span. */
    public String text(String content) {
        return content.substring(start, end);
    }

    /**
     * Returns {@code content} with this span replaced by {@code replacement}.
     */
    public String replaceIn(String content, String replacement) {
        return content.substring(0, start) + replacement + content.substring(end);
    }
}
