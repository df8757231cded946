package patcher.rule;

import patcher.alert.PatchAlertLogger;
import patcher.config.MatchMode;
import patcher.locate.Span;
import patcher.locate.StructuralLocator;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Injects an import entry into the import block, right after an anchor entry.
 *
 * <p>The new line takes the anchor line's indentation. Files without an import
 * block, or whose block lacks the anchor, are left alone.
 */
public final class ImportRule implements EditRule {

    private final String anchor;
    private final String entry;
    private final MatchMode matchMode;

    /**
     * @param anchor the import entry to insert after, e.g. {@code "context"}
     * @param entry the import entry to add, e.g. {@code "log/slog"}
     * @param matchMode how an existing entry is recognised
     */
    public ImportRule(String anchor, String entry, MatchMode matchMode) {
        this.anchor = Objects.requireNonNull(anchor, "anchor").trim();
        this.entry = Objects.requireNonNull(entry, "entry").trim();
        this.matchMode = Objects.requireNonNull(matchMode, "matchMode");
    }

    @Override
    public TargetKind kind() {
        return TargetKind.IMPORT_BLOCK;
    }

    @Override
    public String identifier() {
        return entry;
    }

    @Override
    public RuleOutcome apply(String content) {
        Optional<Span> block = StructuralLocator.importBlock(content);
        if (block.isEmpty()) {
            PatchAlertLogger.spanAbsent(id());
            return RuleOutcome.unchanged(content);
        }
        String text = block.get().text(content);
        if (alreadyImported(text)) {
            return RuleOutcome.unchanged(content);
        }

        int lineStart = 0;
        while (lineStart <= text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            if (lineEnd < 0) lineEnd = text.length();
            String line = text.substring(lineStart, lineEnd);
            if (declares(line, anchor)) {
                int insertAt = block.get().start() + lineEnd;
                String added = "\n" + ListAppender.indentOfLastLine(line) + entry;
                return RuleOutcome.of(content,
                        content.substring(0, insertAt) + added + content.substring(insertAt));
            }
            lineStart = lineEnd + 1;
        }
        PatchAlertLogger.spanAbsent(id());
        return RuleOutcome.unchanged(content);
    }

    private boolean alreadyImported(String block) {
        if (matchMode == MatchMode.SUBSTRING) {
            return block.toLowerCase(Locale.ROOT).contains(unquote(entry).toLowerCase(Locale.ROOT));
        }
        for (String line : block.split("\n")) {
            if (declares(line, entry)) {
                return true;
            }
        }
        return false;
    }

    // Accepts aliased imports: `slog "log/slog"` declares "log/slog".
    private static boolean declares(String line, String importEntry) {
        String code = line;
        int comment = code.indexOf("//");
        if (comment >= 0) code = code.substring(0, comment);
        code = code.trim();
        return code.equals(importEntry) || code.endsWith(" " + importEntry) || code.endsWith("\t" + importEntry);
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && s.charAt(0) == '"' && s.charAt(s.length() - 1) == '"') {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }

    @Override
    public String toString() {
        return "ImportRule{" + anchor + " -> " + entry + "}";
    }
}
