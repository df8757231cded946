package patcher.rule;

/**
 * The kind of construct an {@link EditRule} edits.
 */
public enum TargetKind {
    IMPORT_BLOCK("import"),
    PLACEHOLDER_STATEMENT("placeholder"),
    STRUCT_BODY("field"),
    CONSTRUCTOR_PARAMS("constructor"),
    CALL_ARGS("call");

    private final String label;

    TargetKind(String label) {
        this.label = label;
    }

    /** Returns the short label used in rule ids, e.g. {@code field}. */
    public String label() {
        return label;
    }
}
