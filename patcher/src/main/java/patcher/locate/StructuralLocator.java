package patcher.locate;

import patcher.alert.PatchAlertLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates structural spans in source text without parsing it.
 *
 * <p>Each construct is found by a header pattern ending in its opening delimiter
 * (e.g. the {@code type Foo struct} line) and closed with {@link DelimiterScanner}, so nested delimiters inside the span
 * do not end it early. Returned spans cover the inside of the delimiters only.
 *
 * <p>A missing construct yields an empty result. An opener without a matching
 * closer is logged as {@code SPAN_UNBALANCED} and also yields an empty result.
 */
public final class StructuralLocator {

    private static final Pattern IMPORT_BLOCK = Pattern.compile("(?m)^import\\s*\\(");
    private static final Pattern FUNC_DECLARATION_PREFIX =
            Pattern.compile("\\bfunc\\s*(\\([^()]*\\)\\s*)?$");

    private StructuralLocator() {}

    /**
     * Locates the parenthesized import block.
     *
     * @param content the file content
     * @return the inside of {@code import ( ... )}, if present
     */
    public static Optional<Span> importBlock(String content) {
        Matcher m = IMPORT_BLOCK.matcher(content);
        if (!m.find()) {
            return Optional.empty();
        }
        return inside(content, m.end() - 1, "import");
    }

    /**
     * Locates the body of a struct type declaration.
     *
     * @param content the file content
     * @param typeName the struct type name
     * @return the inside of {@code type <typeName> struct { ... }}, if present
     */
    public static Optional<Span> structBody(String content, String typeName) {
        Pattern header = Pattern.compile("\\btype\\s+" + Pattern.quote(typeName) + "\\s+struct\\s*\\{");
        Matcher m = header.matcher(content);
        if (!m.find()) {
            return Optional.empty();
        }
        return inside(content, m.end() - 1, "field:" + typeName);
    }

    /**
     * Locates the parameter list of a function declaration.
     *
     * <p>When {@code returnMarker} is given, only a declaration whose closing
     * parenthesis is followed by the marker (optionally inside a result tuple)
     * qualifies.
     *
     * @param content the file content
     * @param functionName the function name
     * @param returnMarker the result type that must follow, e.g. {@code *Foo}, or null
     * @return the inside of {@code func <functionName>( ... )}, if present
     */
    public static Optional<Span> parameterList(String content, String functionName, String returnMarker) {
        Pattern header = Pattern.compile("\\bfunc\\s+" + Pattern.quote(functionName) + "\\s*\\(");
        Matcher m = header.matcher(content);
        while (m.find()) {
            int open = m.end() - 1;
            int close = DelimiterScanner.findClose(content, open);
            if (close < 0) {
                PatchAlertLogger.spanUnbalanced("constructor:" + functionName, open);
                return Optional.empty();
            }
            if (returnMarker == null || followedByMarker(content, close + 1, returnMarker)) {
                return Optional.of(new Span(open + 1, close));
            }
        }
        return Optional.empty();
    }

    /**
     * Locates the body of the function whose parameter list ends at {@code paramsEnd}.
     *
     * @param content the file content
     * @param paramsEnd index of the parameter list's closing parenthesis
     * @return the inside of the function body braces, if present
     */
    public static Optional<Span> functionBody(String content, int paramsEnd) {
        int open = content.indexOf('{', paramsEnd);
        if (open < 0) {
            return Optional.empty();
        }
        return inside(content, open, "body@" + paramsEnd);
    }

    /**
     * Locates the first {@code &<typeName>{ ... }} struct literal inside {@code within}.
     *
     * @param content the file content
     * @param typeName the literal's type name
     * @param within the region to search
     * @return the inside of the literal braces, if present
     */
    public static Optional<Span> compositeLiteral(String content, String typeName, Span within) {
        Pattern header = Pattern.compile("&\\s*" + Pattern.quote(typeName) + "\\s*\\{");
        Matcher m = header.matcher(content).region(within.start(), within.end());
        if (!m.find()) {
            return Optional.empty();
        }
        return inside(content, m.end() - 1, "literal:" + typeName)
                .filter(s -> s.end() <= within.end());
    }

    /**
     * Locates the argument lists of every call to {@code callName}.
     *
     * <p>Declarations ({@code func callName(} and method declarations) are not call sites,
     * nor are mentions inside comments and string literals.
     * Spans are returned in source order; nested calls yield nested spans.
     *
     * @param content the file content
     * @param callName the called function name
     * @return the inside of each call's parentheses
     */
    public static List<Span> callArguments(String content, String callName) {
        Pattern header = Pattern.compile("\\b" + Pattern.quote(callName) + "\\s*\\(");
        Matcher m = header.matcher(content);
        List<Span> spans = new ArrayList<>();
        while (m.find()) {
            if (!DelimiterScanner.isCode(content, m.start()) || isDeclaration(content, m.start())) {
                continue;
            }
            int open = m.end() - 1;
            int close = DelimiterScanner.findClose(content, open);
            if (close < 0) {
                PatchAlertLogger.spanUnbalanced("call:" + callName, open);
                continue;
            }
            spans.add(new Span(open + 1, close));
        }
        return spans;
    }

    /**
     * Locates every placeholder: a marker comment line immediately followed by
     * the fallback statement line. Surrounding indentation is ignored when matching.
     *
     * @param content the file content
     * @param marker the trimmed marker line
     * @param fallback the trimmed fallback statement
     * @return spans covering both lines, from the first line's indentation to the end of the fallback
     */
    public static List<Span> placeholders(String content, String marker, String fallback) {
        Pattern pattern = Pattern.compile("(?m)^[ \\t]*" + Pattern.quote(marker)
                + "[ \\t]*\\r?\\n[ \\t]*" + Pattern.quote(fallback));
        Matcher m = pattern.matcher(content);
        List<Span> spans = new ArrayList<>();
        while (m.find()) {
            spans.add(new Span(m.start(), m.end()));
        }
        return spans;
    }

    private static Optional<Span> inside(String content, int open, String label) {
        int close = DelimiterScanner.findClose(content, open);
        if (close < 0) {
            PatchAlertLogger.spanUnbalanced(label, open);
            return Optional.empty();
        }
        return Optional.of(new Span(open + 1, close));
    }

    private static boolean followedByMarker(String content, int from, String marker) {
        int i = from;
        while (i < content.length() && (content.charAt(i) == ' ' || content.charAt(i) == '\t')) i++;
        if (i < content.length() && content.charAt(i) == '(') i++;
        if (!content.startsWith(marker, i)) {
            return false;
        }
        int after = i + marker.length();
        return after >= content.length() || !Character.isJavaIdentifierPart(content.charAt(after));
    }

    private static boolean isDeclaration(String content, int nameStart) {
        int lineStart = content.lastIndexOf('\n', nameStart - 1) + 1;
        return FUNC_DECLARATION_PREFIX.matcher(content.substring(lineStart, nameStart)).find();
    }
}
