package patcher.commit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import patcher.engine.FileRewriter;
import patcher.engine.Rewrite;
import patcher.exceptions.PatchException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Holds rewritten contents in memory until the whole file set has been transformed.
 *
 * <p>Used by {@link patcher.config.WriteMode#STAGED} runs: a read failure on any
 * file aborts the run before anything is written. {@link #commit()} then writes
 * every staged file; a write failure during commit still leaves earlier files
 * written, since the filesystem offers no multi-file transaction.
 *
 * @see patcher.engine.PatchEngine
 */
public class StagedCommit {

    private static final Logger log = LoggerFactory.getLogger(StagedCommit.class);

    private final FileRewriter rewriter;
    private final List<Rewrite> staged = new ArrayList<>();
    private boolean committed;

    public StagedCommit(FileRewriter rewriter) {
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter");
    }

    /**
     * Stages a rewrite. Unchanged rewrites are ignored.
     *
     * @param rewrite the in-memory rewrite
     * @throws IllegalStateException if already committed
     */
    public void stage(Rewrite rewrite) {
        if (committed) {
            throw new IllegalStateException("Already committed");
        }
        if (rewrite.changed()) {
            staged.add(rewrite);
        }
    }

    /** Returns the staged rewrites, in staging order. */
    public List<Rewrite> pending() {
        return Collections.unmodifiableList(staged);
    }

    /**
     * Writes every staged rewrite.
     *
     * @return the number of files written
     * @throws PatchException if a write fails
     */
    public int commit() throws PatchException {
        if (committed) {
            throw new IllegalStateException("Already committed");
        }
        committed = true;
        int written = 0;
        for (Rewrite rewrite : staged) {
            try {
                if (rewriter.writeBack(rewrite)) {
                    written++;
                }
            } catch (PatchException e) {
                throw new PatchException("Commit aborted after " + written + " of " + staged.size()
                        + " files", rewrite.path(), null, "commit", e);
            }
        }
        log.debug("Committed {} staged files", written);
        return written;
    }
}
