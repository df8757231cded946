package patcher.doc;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inserts a fixed line after every block of a document that matches an anchor.
 *
 * <p>The line is inserted on its own line right after the anchor match, with the
 * indentation of the anchor's last line. An anchor already followed by a line
 * with the same key (the text before the first {@code :}, or the whole line)
 * is left alone, so repeated runs converge.
 *
 * <h2>Example (compose healthchecks):</h2>
 * <pre>
 * new DocumentPatch("test: \\[\"CMD\", \"wget\"[^\\]]*healthz\"\\]\\n\\s+interval: 10s",
 *                   "start_period: 30s");
 * </pre>
 */
public final class DocumentPatch {

    private final Pattern anchor;
    private final String line;
    private final String key;

    /**
     * @param anchorRegex regular expression matching the anchor block (may span lines)
     * @param line the line to insert, without indentation
     */
    public DocumentPatch(String anchorRegex, String line) {
        this.anchor = Pattern.compile(Objects.requireNonNull(anchorRegex, "anchorRegex"));
        this.line = Objects.requireNonNull(line, "line").trim();
        int colon = this.line.indexOf(':');
        this.key = colon < 0 ? this.line : this.line.substring(0, colon + 1);
    }

    /**
     * Applies the patch.
     *
     * @param content the document content
     * @return the patched content, equal to the input if nothing needed inserting
     */
    public String apply(String content) {
        List<Integer> insertions = new ArrayList<>();
        List<String> indents = new ArrayList<>();
        Matcher m = anchor.matcher(content);
        while (m.find()) {
            if (!followedByKey(content, m.end())) {
                insertions.add(m.end());
                indents.add(indentOfLine(content, m.end()));
            }
        }

        StringBuilder sb = new StringBuilder(content);
        for (int i = insertions.size() - 1; i >= 0; i--) {
            sb.insert(insertions.get(i), "\n" + indents.get(i) + line);
        }
        return sb.toString();
    }

    private boolean followedByKey(String content, int end) {
        int lineEnd = content.indexOf('\n', end);
        if (lineEnd < 0) {
            return false;
        }
        int nextEnd = content.indexOf('\n', lineEnd + 1);
        String next = content.substring(lineEnd + 1, nextEnd < 0 ? content.length() : nextEnd);
        return next.trim().startsWith(key);
    }

    // indentation of the line holding the character before index
    private static String indentOfLine(String content, int index) {
        int start = content.lastIndexOf('\n', Math.max(0, index - 1)) + 1;
        int i = start;
        while (i < content.length() && (content.charAt(i) == ' ' || content.charAt(i) == '\t')) i++;
        return content.substring(start, i);
    }
}
