package patcher.rule;

import patcher.config.MatchMode;
import patcher.locate.Span;
import patcher.locate.StructuralLocator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Adds a trailing argument to every call site of a function.
 *
 * <p>Under {@link MatchMode#STRICT} a call already passes the argument when one
 * of its arguments is rooted at, or selects, the argument's name or a suppress
 * keyword: {@code logger}, {@code h.logger} and {@code logger.With("svc", "fx")}
 * all count for {@code logger}.
 *
 * <p>Call sites are edited from the one ending last to the one ending first,
 * so an outer call is extended before the nested call inside it and no
 * located offset goes stale.
 */
public final class CallArgumentRule implements EditRule {

    private final String functionName;
    private final String argument;
    private final List<String> suppressKeywords;
    private final MatchMode matchMode;
    private final Set<String> presentNames;

    /**
     * @param functionName the called function
     * @param argument the argument expression to add, e.g. {@code logger}
     * @param suppressKeywords keywords that also count as present: substrings under
     *                         {@link MatchMode#SUBSTRING}, identifiers under {@link MatchMode#STRICT}
     * @param matchMode how an existing argument is recognised
     */
    public CallArgumentRule(String functionName, String argument, List<String> suppressKeywords,
                            MatchMode matchMode) {
        this.functionName = Objects.requireNonNull(functionName, "functionName");
        this.argument = Objects.requireNonNull(argument, "argument").trim();
        this.suppressKeywords = suppressKeywords == null ? List.of() : List.copyOf(suppressKeywords);
        this.matchMode = Objects.requireNonNull(matchMode, "matchMode");
        this.presentNames = new HashSet<>(this.suppressKeywords);
        this.presentNames.add(lastSelector(this.argument));
        this.presentNames.remove("");
    }

    @Override
    public TargetKind kind() {
        return TargetKind.CALL_ARGS;
    }

    @Override
    public String identifier() {
        return functionName;
    }

    @Override
    public RuleOutcome apply(String content) {
        List<Span> calls = new ArrayList<>(StructuralLocator.callArguments(content, functionName));
        calls.sort(Comparator.comparingInt(Span::end).reversed());

        String result = content;
        for (Span call : calls) {
            String args = call.text(result);
            if (!hasArgument(args)) {
                result = call.replaceIn(result, ListAppender.appendElement(args, argument));
            }
        }
        return RuleOutcome.of(content, result);
    }

    private boolean hasArgument(String args) {
        if (matchMode == MatchMode.SUBSTRING) {
            String lower = args.toLowerCase(Locale.ROOT);
            if (lower.contains(argument.toLowerCase(Locale.ROOT))) {
                return true;
            }
            return suppressKeywords.stream()
                    .anyMatch(k -> lower.contains(k.toLowerCase(Locale.ROOT)));
        }
        for (String entry : ListAppender.splitTopLevel(args)) {
            if (entry.equals(argument)
                    || presentNames.contains(rootIdentifier(entry))
                    || presentNames.contains(lastSelector(entry))) {
                return true;
            }
        }
        return false;
    }

    // logger.With("svc", "fx") -> logger
    static String rootIdentifier(String expression) {
        String trimmed = expression.trim();
        int end = 0;
        while (end < trimmed.length() && Character.isJavaIdentifierPart(trimmed.charAt(end))) end++;
        return trimmed.substring(0, end);
    }

    // h.logger -> logger, slog.Default() -> Default
    static String lastSelector(String expression) {
        String trimmed = expression.trim();
        int call = trimmed.indexOf('(');
        String path = call < 0 ? trimmed : trimmed.substring(0, call);
        return path.substring(path.lastIndexOf('.') + 1).trim();
    }

    @Override
    public String toString() {
        return "CallArgumentRule{" + functionName + "(..., " + argument + ")}";
    }
}
