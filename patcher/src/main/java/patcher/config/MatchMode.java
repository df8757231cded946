package patcher.config;

/**
 * How a rule decides that its edit is already present.
 *
 * @see PatchConfig#matchMode()
 */
public enum MatchMode {
    /**
     * Exact structural predicates: a declared import line, a field or parameter
     * whose first token is the name, a literal key, an argument equal to the expression.
     */
    STRICT,

    /**
     * Case-insensitive substring tests over the located span. Broader than
     * {@link #STRICT}: any token sharing the name (or a suppress keyword) counts as present.
     */
    SUBSTRING
}
