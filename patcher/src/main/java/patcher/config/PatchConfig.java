package patcher.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Central configuration for a patch run.
 *
 * <p>This class encapsulates all configurable parameters of the engine:
 * <ul>
 *   <li>The glob pattern selecting the files to patch</li>
 *   <li>The target catalog ({@link EditCatalog})</li>
 *   <li>Write mode, match mode and dry-run switch</li>
 *   <li>Report verbosity and alert level</li>
 *   <li>The optional document patch</li>
 * </ul>
 *
 * <p>Configuration can be loaded from {@code patch.properties} or
 * {@code patch.yml} using {@link PatchConfigLoader}.
 *
 * @see PatchConfigLoader
 * @see patcher.engine.PatchEngine#applyConfig(PatchConfig)
 */
public final class PatchConfig {

    public static final PatchConfig DEFAULTS = builder().build();

    private final String filePattern;
    private final EditCatalog catalog;
    private final WriteMode writeMode;
    private final MatchMode matchMode;
    private final boolean reportUnchanged;
    private final boolean dryRun;
    private final AlertLevel alertLevel;
    private final DocumentEdit documentEdit;

    private PatchConfig(Builder b) {
        this.filePattern = b.filePattern;
        this.catalog = b.catalog;
        this.writeMode = b.writeMode;
        this.matchMode = b.matchMode;
        this.reportUnchanged = b.reportUnchanged;
        this.dryRun = b.dryRun;
        this.alertLevel = b.alertLevel;
        this.documentEdit = b.documentEdit;
    }

    /**
     * Creates a new configuration builder.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the glob pattern, relative to the run root, selecting the files to patch. */
    public String filePattern() { return filePattern; }

    /** Returns the target catalog. */
    public EditCatalog catalog() { return catalog; }

    /** Returns when changed files are written back. */
    public WriteMode writeMode() { return writeMode; }

    /** Returns how rules decide their edit is already present. */
    public MatchMode matchMode() { return matchMode; }

    /** Returns true if unchanged files are listed in the run report. */
    public boolean reportUnchanged() { return reportUnchanged; }

    /** Returns true if changes are computed and reported but never written. */
    public boolean dryRun() { return dryRun; }

    /** Returns the alert level for logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    /** Returns the document patch, if configured. */
    public Optional<DocumentEdit> documentEdit() { return Optional.ofNullable(documentEdit); }

    /**
     * Returns a copy of this configuration with the dry-run switch set.
     *
     * @param dryRun the new dry-run value
     * @return a new configuration
     */
    public PatchConfig withDryRun(boolean dryRun) {
        return toBuilder().dryRun(dryRun).build();
    }

    /**
     * Returns a builder pre-populated with this configuration.
     */
    public Builder toBuilder() {
        return builder()
                .filePattern(filePattern)
                .catalog(catalog)
                .writeMode(writeMode)
                .matchMode(matchMode)
                .reportUnchanged(reportUnchanged)
                .dryRun(dryRun)
                .alertLevel(alertLevel)
                .documentEdit(documentEdit);
    }

    @Override
    public String toString() {
        return "PatchConfig{" +
                "filePattern=" + filePattern +
                ", writeMode=" + writeMode +
                ", matchMode=" + matchMode +
                ", reportUnchanged=" + reportUnchanged +
                ", dryRun=" + dryRun +
                ", alertLevel=" + alertLevel +
                ", catalog=" + catalog +
                ", document=" + documentEdit +
                '}';
    }

    /**
     * Line to insert after an anchor block of one configuration document.
     *
     * @param path the document path, relative to the run root
     * @param anchor regular expression matching the anchor block
     * @param line the line to insert (without indentation)
     */
    public record DocumentEdit(String path, String anchor, String line) {
        public DocumentEdit {
            Objects.requireNonNull(path, "path");
            Objects.requireNonNull(anchor, "anchor");
            Objects.requireNonNull(line, "line");
        }
    }

    /**
     * Builder for constructing {@link PatchConfig} instances.
     */
    public static final class Builder {
        private String filePattern = "**/*.go";
        private EditCatalog catalog = EditCatalog.EMPTY;
        private WriteMode writeMode = WriteMode.INCREMENTAL;
        private MatchMode matchMode = MatchMode.STRICT;
        private boolean reportUnchanged = true;
        private boolean dryRun = false;
        private AlertLevel alertLevel = AlertLevel.WARNING;
        private DocumentEdit documentEdit;

        public Builder filePattern(String pattern) {
            if (pattern == null || pattern.isBlank()) {
                throw new IllegalArgumentException("filePattern must not be blank");
            }
            this.filePattern = pattern.trim();
            return this;
        }

        public Builder catalog(EditCatalog catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
            return this;
        }

        public Builder writeMode(WriteMode mode) {
            this.writeMode = Objects.requireNonNull(mode, "writeMode");
            return this;
        }

        public Builder matchMode(MatchMode mode) {
            this.matchMode = Objects.requireNonNull(mode, "matchMode");
            return this;
        }

        public Builder reportUnchanged(boolean reportUnchanged) {
            this.reportUnchanged = reportUnchanged;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public Builder documentEdit(DocumentEdit edit) {
            this.documentEdit = edit;
            return this;
        }

        public PatchConfig build() {
            return new PatchConfig(this);
        }
    }
}
