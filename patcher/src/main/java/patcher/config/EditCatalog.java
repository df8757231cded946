package patcher.config;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable target catalog: which constructs the engine edits and with what text.
 *
 * <p>Each section is optional. A section that is not configured produces no rule.
 * The catalog is fixed for a run and shared read-only by every file rewrite.
 *
 * <h2>Example (Go gRPC handlers):</h2>
 * <pre>
 * EditCatalog catalog = EditCatalog.builder()
 *     .importEdit(new ImportEdit("\"context\"", "\"log/slog\""))
 *     .fieldEdit(new FieldEdit(List.of("FXHandler"), "logger", "logger *slog.Logger"))
 *     .build();
 * </pre>
 *
 * @see patcher.plan.PatchPlan#fromCatalog(EditCatalog, MatchMode)
 */
public final class EditCatalog {

    public static final EditCatalog EMPTY = builder().build();

    private final ImportEdit importEdit;
    private final PlaceholderEdit placeholderEdit;
    private final FieldEdit fieldEdit;
    private final ConstructorEdit constructorEdit;
    private final CallEdit callEdit;

    private EditCatalog(Builder b) {
        this.importEdit = b.importEdit;
        this.placeholderEdit = b.placeholderEdit;
        this.fieldEdit = b.fieldEdit;
        this.constructorEdit = b.constructorEdit;
        this.callEdit = b.callEdit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<ImportEdit> importEdit() { return Optional.ofNullable(importEdit); }

    public Optional<PlaceholderEdit> placeholderEdit() { return Optional.ofNullable(placeholderEdit); }

    public Optional<FieldEdit> fieldEdit() { return Optional.ofNullable(fieldEdit); }

    public Optional<ConstructorEdit> constructorEdit() { return Optional.ofNullable(constructorEdit); }

    public Optional<CallEdit> callEdit() { return Optional.ofNullable(callEdit); }

    /** Returns true if no section is configured. */
    public boolean isEmpty() {
        return importEdit == null && placeholderEdit == null && fieldEdit == null
                && constructorEdit == null && callEdit == null;
    }

    @Override
    public String toString() {
        return "EditCatalog{" +
                "import=" + importEdit +
                ", placeholder=" + placeholderEdit +
                ", field=" + fieldEdit +
                ", constructor=" + constructorEdit +
                ", call=" + callEdit +
                '}';
    }

    /**
     * Import to inject after an anchor entry of the import block.
     *
     * @param anchor the existing import entry to insert after, e.g. {@code "context"}
     * @param entry the import entry to add, e.g. {@code "log/slog"}
     */
    public record ImportEdit(String anchor, String entry) {
        public ImportEdit {
            Objects.requireNonNull(anchor, "anchor");
            Objects.requireNonNull(entry, "entry");
        }
    }

    /**
     * Two-line placeholder to substitute.
     *
     * @param marker the marker comment line (trimmed text)
     * @param fallback the fallback statement line that follows the marker (trimmed text)
     * @param replacement the statement that takes the marker's place
     */
    public record PlaceholderEdit(String marker, String fallback, String replacement) {
        public PlaceholderEdit {
            Objects.requireNonNull(marker, "marker");
            Objects.requireNonNull(fallback, "fallback");
            Objects.requireNonNull(replacement, "replacement");
        }
    }

    /**
     * Field to add to each listed struct.
     *
     * @param types struct type names
     * @param fieldName the field name used by the already-present check
     * @param declaration the full field declaration line
     */
    public record FieldEdit(List<String> types, String fieldName, String declaration) {
        public FieldEdit {
            types = List.copyOf(types);
            Objects.requireNonNull(fieldName, "fieldName");
            Objects.requireNonNull(declaration, "declaration");
        }
    }

    /**
     * Trailing parameter to add to each listed type's constructor.
     *
     * <p>The constructor of type {@code T} is {@code prefix + T}; its parameter
     * list must be followed by the return marker {@code *T}, and the struct
     * literal {@code &T{...}} it returns gets the assignment entry.
     *
     * @param types constructed type names
     * @param prefix constructor name prefix, usually {@code New}
     * @param parameter the parameter declaration, e.g. {@code logger *slog.Logger}
     * @param assignment the literal entry, e.g. {@code logger: logger} (may be null)
     */
    public record ConstructorEdit(List<String> types, String prefix, String parameter, String assignment) {
        public ConstructorEdit {
            types = List.copyOf(types);
            Objects.requireNonNull(prefix, "prefix");
            Objects.requireNonNull(parameter, "parameter");
        }

        /** Returns the parameter name, the first token of the declaration. */
        public String parameterName() {
            return firstToken(parameter);
        }

        /** Returns the literal key of the assignment, or null if no assignment is configured. */
        public String assignmentKey() {
            if (assignment == null) return null;
            int colon = assignment.indexOf(':');
            return (colon < 0 ? assignment : assignment.substring(0, colon)).trim();
        }
    }

    /**
     * Trailing argument to add to each call site of the listed functions.
     *
     * @param functions call target names
     * @param argument the argument expression, e.g. {@code logger}
     * @param suppressKeywords additional keywords that count as already present
     *        under {@link MatchMode#SUBSTRING}
     */
    public record CallEdit(List<String> functions, String argument, List<String> suppressKeywords) {
        public CallEdit {
            functions = List.copyOf(functions);
            Objects.requireNonNull(argument, "argument");
            suppressKeywords = suppressKeywords == null ? List.of() : List.copyOf(suppressKeywords);
        }
    }

    static String firstToken(String declaration) {
        String trimmed = declaration.trim();
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) {
            end++;
        }
        return trimmed.substring(0, end);
    }

    /**
     * Builder for constructing {@link EditCatalog} instances.
     */
    public static final class Builder {
        private ImportEdit importEdit;
        private PlaceholderEdit placeholderEdit;
        private FieldEdit fieldEdit;
        private ConstructorEdit constructorEdit;
        private CallEdit callEdit;

        public Builder importEdit(ImportEdit edit) {
            this.importEdit = edit;
            return this;
        }

        public Builder placeholderEdit(PlaceholderEdit edit) {
            this.placeholderEdit = edit;
            return this;
        }

        public Builder fieldEdit(FieldEdit edit) {
            this.fieldEdit = edit;
            return this;
        }

        public Builder constructorEdit(ConstructorEdit edit) {
            this.constructorEdit = edit;
            return this;
        }

        public Builder callEdit(CallEdit edit) {
            this.callEdit = edit;
            return this;
        }

        public EditCatalog build() {
            return new EditCatalog(this);
        }
    }
}
