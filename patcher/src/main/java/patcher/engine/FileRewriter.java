package patcher.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import patcher.exceptions.PatchException;
import patcher.files.ContentStore;
import patcher.plan.PatchPlan;
import patcher.report.FileVerdict;
import patcher.rule.EditRule;
import patcher.rule.RuleOutcome;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies a plan to one file: read once, transform in memory, write back at most once.
 *
 * <p>Rules run in plan order, each on the content left by the previous one.
 * The file is written only when the final content differs from what was read,
 * so a file on which every rule's postcondition already holds is never touched.
 */
public final class FileRewriter {

    private static final Logger log = LoggerFactory.getLogger(FileRewriter.class);

    private final ContentStore store;

    public FileRewriter(ContentStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Reads a file and applies the plan in memory.
     *
     * @param path the file
     * @param plan the rules to apply
     * @return the in-memory rewrite
     * @throws PatchException if the file cannot be read
     */
    public Rewrite transform(Path path, PatchPlan plan) throws PatchException {
        String content;
        try {
            content = store.read(path);
        } catch (IOException e) {
            throw new PatchException("Failed to read file", path, null, "read", e);
        }
        return applyAll(path, content, plan);
    }

    /**
     * Writes a rewrite back if it changed anything.
     *
     * @param rewrite the rewrite to persist
     * @return true if the file was written
     * @throws PatchException if the file cannot be written
     */
    public boolean writeBack(Rewrite rewrite) throws PatchException {
        if (!rewrite.changed()) {
            return false;
        }
        try {
            store.write(rewrite.path(), rewrite.updated());
        } catch (IOException e) {
            throw new PatchException("Failed to write file", rewrite.path(), null, "write", e);
        }
        log.debug("Wrote {} ({} rules applied)", rewrite.path(), rewrite.appliedRules().size());
        return true;
    }

    /**
     * Transforms a file and writes it back if changed.
     *
     * @param path the file
     * @param plan the rules to apply
     * @param dryRun if true, never write
     * @return the file's verdict
     * @throws PatchException if the file cannot be read or written
     */
    public FileVerdict rewrite(Path path, PatchPlan plan, boolean dryRun) throws PatchException {
        Rewrite rewrite = transform(path, plan);
        if (!dryRun) {
            writeBack(rewrite);
        }
        return rewrite.verdict();
    }

    /**
     * Applies every rule of the plan to the given content. No I/O.
     *
     * @param path the file the content belongs to (for the result only)
     * @param content the content
     * @param plan the rules to apply
     * @return the rewrite
     */
    public static Rewrite applyAll(Path path, String content, PatchPlan plan) {
        String current = content;
        List<String> applied = new ArrayList<>();
        for (EditRule rule : plan.rules()) {
            RuleOutcome outcome = rule.apply(current);
            if (outcome.changed()) {
                applied.add(rule.id());
                current = outcome.content();
            }
        }
        return new Rewrite(path, content, current, applied);
    }
}
