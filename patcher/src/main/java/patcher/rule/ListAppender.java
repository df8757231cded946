package patcher.rule;

import java.util.ArrayList;
import java.util.List;

/**
 * Text helpers for appending to delimited lists and reading their entries.
 *
 * <p>Separator rules for comma-separated lists:
 * <ul>
 *   <li>single line: {@code ", "} before the new element, or a single space after an existing trailing comma</li>
 *   <li>multi line ending in a comma: the element goes on its own line and keeps the trailing comma style</li>
 *   <li>multi line without trailing comma: exactly one comma, then the element on its own line</li>
 * </ul>
 * A trailing {@code //} comment on the last element stays on that element's line.
 */
final class ListAppender {

    private ListAppender() {}

    /**
     * Appends {@code element} to the comma-separated list {@code inner}
     * (the text between the list's delimiters).
     */
    static String appendElement(String inner, String element) {
        String head = inner.stripTrailing();
        String tail = inner.substring(head.length());
        if (head.isEmpty()) {
            return element + tail;
        }
        if (inner.indexOf('\n') < 0) {
            return head + (head.endsWith(",") ? " " : ", ") + element + tail;
        }
        String indent = indentOfLastLine(head);
        int codeEnd = lastCodeEnd(head);
        if (codeEnd == 0) {
            return head + "\n" + indent + element + tail;
        }
        if (head.charAt(codeEnd - 1) == ',') {
            return head + "\n" + indent + element + "," + tail;
        }
        // the comma goes right after the last element, ahead of any trailing comment
        return head.substring(0, codeEnd) + "," + head.substring(codeEnd) + "\n" + indent + element + tail;
    }

    /**
     * Returns the index just past the last non-blank character of {@code text}
     * that is not part of a line comment.
     */
    private static int lastCodeEnd(String text) {
        int end = 0;
        int lineStart = 0;
        while (lineStart <= text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            if (lineEnd < 0) lineEnd = text.length();
            String code = text.substring(lineStart, lineStart + codeLength(text.substring(lineStart, lineEnd)));
            String stripped = code.stripTrailing();
            if (!stripped.isBlank()) {
                end = lineStart + stripped.length();
            }
            lineStart = lineEnd + 1;
        }
        return end;
    }

    // length of the line before its // comment, outside string literals
    private static int codeLength(String line) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\' && quote != '`') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'' || c == '`') {
                quote = c;
            } else if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                return i;
            }
        }
        return line.length();
    }

    /**
     * Appends {@code line} to the newline-separated body {@code body}
     * (the text between a block's braces), after the last non-blank line.
     */
    static String appendLine(String body, String line) {
        String head = body.stripTrailing();
        String tail = body.substring(head.length());
        if (head.isEmpty()) {
            return "\n\t" + line + "\n";
        }
        String indent = body.indexOf('\n') < 0 ? "\t" : indentOfLastLine(head);
        if (indent.isEmpty()) {
            indent = "\t";
        }
        return head + "\n" + indent + line + tail;
    }

    /**
     * Splits a list on commas at nesting depth zero, outside string literals and line comments.
     * Entries are trimmed; empty entries (e.g. after a trailing comma) are dropped.
     */
    static List<String> splitTopLevel(String inner) {
        List<String> entries = new ArrayList<>();
        int depth = 0;
        int start = 0;
        char quote = 0;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (quote != 0) {
                if (c == '\\' && quote != '`') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '/' && i + 1 < inner.length() && inner.charAt(i + 1) == '/') {
                int newline = inner.indexOf('\n', i);
                i = (newline < 0 ? inner.length() : newline) - 1;
                continue;
            }
            switch (c) {
                case '"', '\'', '`' -> quote = c;
                case '(', '[', '{' -> depth++;
                case ')', ']', '}' -> depth--;
                case ',' -> {
                    if (depth == 0) {
                        addEntry(entries, inner.substring(start, i));
                        start = i + 1;
                    }
                }
                default -> { }
            }
        }
        addEntry(entries, inner.substring(start));
        return entries;
    }

    /** Returns the leading whitespace of the last line of {@code text}. */
    static String indentOfLastLine(String text) {
        String last = text.substring(text.lastIndexOf('\n') + 1);
        int i = 0;
        while (i < last.length() && (last.charAt(i) == ' ' || last.charAt(i) == '\t')) i++;
        return last.substring(0, i);
    }

    /** Returns the first whitespace-delimited token of {@code text}. */
    static String firstToken(String text) {
        String trimmed = text.trim();
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) end++;
        return trimmed.substring(0, end);
    }

    private static void addEntry(List<String> entries, String raw) {
        String entry = stripLineComments(raw).trim();
        if (!entry.isEmpty()) {
            entries.add(entry);
        }
    }

    private static String stripLineComments(String text) {
        StringBuilder sb = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            sb.append(line, 0, codeLength(line)).append('\n');
        }
        return sb.toString();
    }
}
