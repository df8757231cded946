package patcher.locate;

/**
 * Finds matching delimiters by counting nesting depth.
 *
 * <p>Only the delimiter class of the opener is counted. String literals
 * ({@code "..."}, {@code `...`}, {@code '...'}) and comments ({@code //},
 * {@code /* *&#47;}) are skipped, so delimiters inside them never close a span.
 */
public final class DelimiterScanner {

    private DelimiterScanner() {}

    /**
     * Returns the index of the delimiter closing the one at {@code openIndex}.
     *
     * @param text the text to scan
     * @param openIndex index of an opening parenthesis, brace or bracket
     * @return index of the matching closer, or -1 if the text ends first
     * @throws IllegalArgumentException if {@code openIndex} does not hold an opening delimiter
     */
    public static int findClose(CharSequence text, int openIndex) {
        char open = text.charAt(openIndex);
        char close = closerOf(open);

        int depth = 0;
        int i = openIndex;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '/' && i + 1 < n && text.charAt(i + 1) == '/') {
                i = skipLineComment(text, i);
                continue;
            }
            if (c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                i = skipBlockComment(text, i);
                continue;
            }
            if (c == '"' || c == '\'') {
                i = skipQuoted(text, i, c);
                continue;
            }
            if (c == '`') {
                i = skipRaw(text, i);
                continue;
            }
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * Tells whether {@code index} lies in code, outside every comment and literal
     * that starts before it.
     *
     * @param text the text to scan
     * @param index the position to test
     * @return false if the position is inside a comment, string or rune literal
     */
    public static boolean isCode(CharSequence text, int index) {
        int n = text.length();
        int i = 0;
        while (i < index && i < n) {
            char c = text.charAt(i);
            int next;
            if (c == '/' && i + 1 < n && text.charAt(i + 1) == '/') {
                next = skipLineComment(text, i);
            } else if (c == '/' && i + 1 < n && text.charAt(i + 1) == '*') {
                next = skipBlockComment(text, i);
            } else if (c == '"' || c == '\'') {
                next = skipQuoted(text, i, c);
            } else if (c == '`') {
                next = skipRaw(text, i);
            } else {
                i++;
                continue;
            }
            if (index < next) {
                return false;
            }
            i = next;
        }
        return true;
    }

    private static char closerOf(char open) {
        switch (open) {
            case '(': return ')';
            case '{': return '}';
            case '[': return ']';
            default:
                throw new IllegalArgumentException("Not an opening delimiter: '" + open + "'");
        }
    }

    private static int skipLineComment(CharSequence text, int i) {
        int n = text.length();
        while (i < n && text.charAt(i) != '\n') i++;
        return i;
    }

    private static int skipBlockComment(CharSequence text, int i) {
        int n = text.length();
        i += 2;
        while (i + 1 < n && !(text.charAt(i) == '*' && text.charAt(i + 1) == '/')) i++;
        return Math.min(n, i + 2);
    }

    // Interpreted strings and runes end at the closing quote or, if unterminated, at the line end.
    private static int skipQuoted(CharSequence text, int i, char quote) {
        int n = text.length();
        i++;
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) return i + 1;
            if (c == '\n') return i;
            i++;
        }
        return n;
    }

    private static int skipRaw(CharSequence text, int i) {
        int n = text.length();
        i++;
        while (i < n && text.charAt(i) != '`') i++;
        return Math.min(n, i + 1);
    }
}
