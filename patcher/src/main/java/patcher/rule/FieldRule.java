package patcher.rule;

import patcher.alert.PatchAlertLogger;
import patcher.config.MatchMode;
import patcher.locate.Span;
import patcher.locate.StructuralLocator;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Adds a field declaration to a struct body, just before its closing brace.
 */
public final class FieldRule implements EditRule {

    private static final Pattern FIELD_NAMES =
            Pattern.compile("^([A-Za-z_]\\w*(?:\\s*,\\s*[A-Za-z_]\\w*)*)\\s+\\S");

    private final String typeName;
    private final String fieldName;
    private final String declaration;
    private final MatchMode matchMode;

    /**
     * @param typeName the struct type to extend
     * @param fieldName the field name checked for presence
     * @param declaration the field declaration line, e.g. {@code logger *slog.Logger}
     * @param matchMode how an existing field is recognised
     */
    public FieldRule(String typeName, String fieldName, String declaration, MatchMode matchMode) {
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.declaration = Objects.requireNonNull(declaration, "declaration").trim();
        this.matchMode = Objects.requireNonNull(matchMode, "matchMode");
    }

    @Override
    public TargetKind kind() {
        return TargetKind.STRUCT_BODY;
    }

    @Override
    public String identifier() {
        return typeName;
    }

    @Override
    public RuleOutcome apply(String content) {
        Optional<Span> body = StructuralLocator.structBody(content, typeName);
        if (body.isEmpty()) {
            PatchAlertLogger.spanAbsent(id());
            return RuleOutcome.unchanged(content);
        }
        String text = body.get().text(content);
        if (hasField(text)) {
            return RuleOutcome.unchanged(content);
        }
        return RuleOutcome.of(content,
                body.get().replaceIn(content, ListAppender.appendLine(text, declaration)));
    }

    private boolean hasField(String body) {
        if (matchMode == MatchMode.SUBSTRING) {
            return body.toLowerCase(Locale.ROOT).contains(fieldName.toLowerCase(Locale.ROOT));
        }
        // only fields of this struct count, not those of nested anonymous structs
        int depth = 0;
        for (String line : body.split("\n")) {
            if (depth == 0) {
                for (String declaration : line.split(";")) {
                    if (declares(declaration)) {
                        return true;
                    }
                }
            }
            depth += braceDelta(line);
        }
        return false;
    }

    private boolean declares(String declaration) {
        Matcher m = FIELD_NAMES.matcher(declaration.trim());
        if (!m.find()) {
            return false;
        }
        for (String name : m.group(1).split(",")) {
            if (name.trim().equals(fieldName)) {
                return true;
            }
        }
        return false;
    }

    // net brace count of a line, ignoring tags, strings and the trailing comment
    private static int braceDelta(String line) {
        int delta = 0;
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\' && quote != '`') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '`') {
                quote = c;
            } else if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                break;
            } else if (c == '{') {
                delta++;
            } else if (c == '}') {
                delta--;
            }
        }
        return delta;
    }

    @Override
    public String toString() {
        return "FieldRule{" + typeName + " += " + declaration + "}";
    }
}
