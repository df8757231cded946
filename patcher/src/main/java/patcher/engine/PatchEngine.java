package patcher.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import patcher.alert.PatchAlertLogger;
import patcher.commit.StagedCommit;
import patcher.config.PatchConfig;
import patcher.config.PatchConfig.DocumentEdit;
import patcher.config.WriteMode;
import patcher.doc.DocumentPatch;
import patcher.exceptions.PatchException;
import patcher.files.ContentStore;
import patcher.files.FileSetResolver;
import patcher.files.FileSystemContentStore;
import patcher.metrics.RunMetrics;
import patcher.metrics.RunMetrics.Phase;
import patcher.metrics.RunMetricsCollector;
import patcher.plan.PatchPlan;
import patcher.report.FileVerdict;
import patcher.report.RunReporter;
import patcher.report.RunSummary;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Batch driver: runs the plan over every file the configured pattern selects.
 *
 *  - resolve the file set (sorted, possibly empty)
 *  - transform each file in memory, one at a time
 *  - write back changed files (as they complete, or all at the end for STAGED runs)
 *  - print one line per file and a trailing total
 *
 * Notes:
 *  - Absent spans are skipped silently by the rules; only I/O failures abort.
 *  - A failed run prints no total line and leaves already-written files in place.
 */
public final class PatchEngine {

    private static final Logger log = LoggerFactory.getLogger(PatchEngine.class);

    // run id generator
    private static final AtomicLong RUN_COUNTER = new AtomicLong(1L);

    private static volatile RunMetrics lastMetrics;

    private final PatchPlan plan;
    private final ContentStore store;
    private final FileRewriter rewriter;
    private final FileSetResolver resolver = new FileSetResolver();
    private final RunMetricsCollector metricsCollector = new RunMetricsCollector();

    private PatchConfig config = PatchConfig.DEFAULTS;
    private PrintStream out = System.out;

    public PatchEngine(PatchPlan plan) {
        this(plan, new FileSystemContentStore());
    }

    public PatchEngine(PatchPlan plan, ContentStore store) {
        this.plan = Objects.requireNonNull(plan, "plan");
        this.store = Objects.requireNonNull(store, "store");
        this.rewriter = new FileRewriter(store);
    }

    /**
     * Creates an engine for the catalog and settings of a configuration.
     *
     * @param config the configuration
     * @return a configured engine
     * @throws PatchException if the catalog does not form a valid plan
     */
    public static PatchEngine fromConfig(PatchConfig config) throws PatchException {
        PatchPlan plan = PatchPlan.fromCatalog(config.catalog(), config.matchMode());
        return new PatchEngine(plan).applyConfig(config);
    }

    /**
     * Apply run settings (pattern, write mode, reporting, alert level).
     * The plan is fixed at construction.
     */
    public PatchEngine applyConfig(PatchConfig config) {
        if (config == null) return this;

        this.config = config;
        PatchAlertLogger.setAlertLevel(config.alertLevel());

        log.debug("Applied config: {}", config);
        return this;
    }

    /**
     * Redirect the run report.
     *
     * @param out the stream receiving the report
     * @return this engine for method chaining
     */
    public PatchEngine withOutput(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
        return this;
    }

    public PatchPlan getPlan() {
        return plan;
    }

    public PatchConfig getConfig() {
        return config;
    }

    /**
     * @return metrics of the most recent successful run in this JVM, or null
     */
    public static RunMetrics getLastMetrics() {
        return lastMetrics;
    }

    /**
     * Runs the plan over every file under {@code root} matching the configured pattern.
     *
     * @param root the directory the pattern is relative to
     * @return the run summary
     * @throws PatchException on the first read or write failure; the run stops there
     */
    public RunSummary run(Path root) throws PatchException {
        long runId = RUN_COUNTER.getAndIncrement();
        boolean dryRun = config.dryRun();
        RunReporter reporter = new RunReporter(out, root, config.reportUnchanged(), dryRun);

        metricsCollector.start(runId);
        PatchAlertLogger.runStarted(runId, root, config.filePattern());

        List<FileVerdict> verdicts = new ArrayList<>();
        int[] written = {0};
        try {
            List<Path> files = metricsCollector.timed(Phase.RESOLVE,
                    () -> resolver.resolve(root, config.filePattern()));
            metricsCollector.filesScanned(files.size());
            log.debug("Run #{} resolved {} files for {}", runId, files.size(), config.filePattern());

            if (config.writeMode() == WriteMode.STAGED && !dryRun) {
                StagedCommit staged = new StagedCommit(rewriter);
                for (Path file : files) {
                    Rewrite rewrite = metricsCollector.timed(Phase.TRANSFORM,
                            () -> rewriter.transform(file, plan));
                    staged.stage(rewrite);
                    verdicts.add(record(runId, rewrite));
                }
                written[0] = metricsCollector.timed(Phase.WRITE_BACK, staged::commit);
                verdicts.forEach(reporter::fileResult);
            } else {
                for (Path file : files) {
                    Rewrite rewrite = metricsCollector.timed(Phase.TRANSFORM,
                            () -> rewriter.transform(file, plan));
                    if (!dryRun && rewrite.changed()) {
                        metricsCollector.timed(Phase.WRITE_BACK, () -> {
                            rewriter.writeBack(rewrite);
                        });
                        written[0]++;
                    }
                    FileVerdict verdict = record(runId, rewrite);
                    verdicts.add(verdict);
                    reporter.fileResult(verdict);
                }
            }
        } catch (PatchException e) {
            PatchAlertLogger.runFailed(runId, e, written[0]);
            throw e;
        }

        RunMetrics metrics = metricsCollector.finish();
        lastMetrics = metrics;

        RunSummary summary = new RunSummary(verdicts, metrics, dryRun);
        reporter.total(summary);
        PatchAlertLogger.runCompleted(metrics);
        return summary;
    }

    /**
     * Applies the configured document patch, if any.
     *
     * @param root the directory the document path is relative to
     * @return the document's verdict, or empty if no document patch is configured
     * @throws PatchException if the document cannot be read or written
     */
    public Optional<FileVerdict> runDocumentPatch(Path root) throws PatchException {
        Optional<DocumentEdit> edit = config.documentEdit();
        if (edit.isEmpty()) {
            return Optional.empty();
        }

        Path document = root.resolve(edit.get().path());
        if (!Files.isRegularFile(document)) {
            throw new PatchException("Document not found", document, null, "read", null);
        }
        String content;
        try {
            content = store.read(document);
        } catch (IOException e) {
            throw new PatchException("Failed to read document", document, null, "read", e);
        }

        String patched = new DocumentPatch(edit.get().anchor(), edit.get().line()).apply(content);
        Rewrite rewrite = new Rewrite(document, content, patched,
                patched.equals(content) ? List.of() : List.of("document:" + edit.get().path()));
        if (!config.dryRun()) {
            rewriter.writeBack(rewrite);
        }

        FileVerdict verdict = rewrite.verdict();
        new RunReporter(out, root, config.reportUnchanged(), config.dryRun()).fileResult(verdict);
        return Optional.of(verdict);
    }

    private FileVerdict record(long runId, Rewrite rewrite) {
        FileVerdict verdict = rewrite.verdict();
        metricsCollector.fileProcessed(verdict.changed(), verdict.appliedRules().size());
        if (verdict.changed()) {
            PatchAlertLogger.fileUpdated(runId, verdict.path(), verdict.appliedRules().size());
        }
        return verdict;
    }
}
