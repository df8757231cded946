package patcher.rule;

import patcher.alert.PatchAlertLogger;
import patcher.config.MatchMode;
import patcher.locate.Span;
import patcher.locate.StructuralLocator;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Adds a trailing parameter to a constructor and the matching entry to the
 * struct literal it returns.
 *
 * <p>For type {@code Foo} and prefix {@code New}, the constructor is
 * {@code func NewFoo(...) *Foo}. The parameter list and the first
 * {@code &Foo{...}} literal in the constructor body are independent targets:
 * each is edited only when it lacks its element.
 */
public final class ConstructorParameterRule implements EditRule {

    private final String typeName;
    private final String functionName;
    private final String parameter;
    private final String parameterName;
    private final String assignment;
    private final String assignmentKey;
    private final MatchMode matchMode;

    /**
     * @param typeName the constructed type
     * @param prefix constructor name prefix, e.g. {@code New}
     * @param parameter parameter declaration, e.g. {@code logger *slog.Logger}
     * @param assignment literal entry, e.g. {@code logger: logger}, or null to leave literals alone
     * @param matchMode how existing elements are recognised
     */
    public ConstructorParameterRule(String typeName, String prefix, String parameter,
                                    String assignment, MatchMode matchMode) {
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.functionName = Objects.requireNonNull(prefix, "prefix") + typeName;
        this.parameter = Objects.requireNonNull(parameter, "parameter").trim();
        this.parameterName = ListAppender.firstToken(this.parameter);
        this.assignment = assignment != null ? assignment.trim() : null;
        this.assignmentKey = assignment != null ? keyOf(assignment) : null;
        this.matchMode = Objects.requireNonNull(matchMode, "matchMode");
    }

    @Override
    public TargetKind kind() {
        return TargetKind.CONSTRUCTOR_PARAMS;
    }

    @Override
    public String identifier() {
        return functionName;
    }

    @Override
    public RuleOutcome apply(String content) {
        String returnMarker = "*" + typeName;
        Optional<Span> params = StructuralLocator.parameterList(content, functionName, returnMarker);
        if (params.isEmpty()) {
            PatchAlertLogger.spanAbsent(id());
            return RuleOutcome.unchanged(content);
        }

        String result = content;
        String paramText = params.get().text(result);
        if (!hasParameter(paramText)) {
            result = params.get().replaceIn(result, ListAppender.appendElement(paramText, parameter));
            params = StructuralLocator.parameterList(result, functionName, returnMarker);
        }

        if (assignment != null && params.isPresent()) {
            result = addAssignment(result, params.get().end());
        }
        return RuleOutcome.of(content, result);
    }

    private String addAssignment(String content, int paramsEnd) {
        Optional<Span> literal = StructuralLocator.functionBody(content, paramsEnd)
                .flatMap(body -> StructuralLocator.compositeLiteral(content, typeName, body));
        if (literal.isEmpty()) {
            return content;
        }
        String text = literal.get().text(content);
        if (hasAssignment(text)) {
            return content;
        }
        return literal.get().replaceIn(content, ListAppender.appendElement(text, assignment));
    }

    private boolean hasParameter(String params) {
        if (matchMode == MatchMode.SUBSTRING) {
            return containsIgnoreCase(params, parameterName);
        }
        return ListAppender.splitTopLevel(params).stream()
                .map(ListAppender::firstToken)
                .anyMatch(parameterName::equals);
    }

    private boolean hasAssignment(String literal) {
        if (matchMode == MatchMode.SUBSTRING) {
            return containsIgnoreCase(literal, assignmentKey + ":");
        }
        return ListAppender.splitTopLevel(literal).stream()
                .filter(e -> e.indexOf(':') > 0)
                .map(ConstructorParameterRule::keyOf)
                .anyMatch(assignmentKey::equals);
    }

    private static String keyOf(String entry) {
        int colon = entry.indexOf(':');
        return (colon < 0 ? entry : entry.substring(0, colon)).trim();
    }

    private static boolean containsIgnoreCase(String text, String needle) {
        return text.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return "ConstructorParameterRule{" + functionName + " += " + parameter + "}";
    }
}
