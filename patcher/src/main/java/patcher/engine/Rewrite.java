package patcher.engine;

import patcher.report.FileVerdict;

import java.nio.file.Path;
import java.util.List;

/**
 * In-memory result of applying a plan to one file, before any write-back.
 *
 * @param path the file
 * @param original the content as read
 * @param updated the content after every rule
 * @param appliedRules ids of the rules that changed the content
 */
public record Rewrite(Path path, String original, String updated, List<String> appliedRules) {

    public Rewrite {
        appliedRules = List.copyOf(appliedRules);
    }

    /** Returns true if the content differs from what was read. */
    public boolean changed() {
        return !updated.equals(original);
    }

    /** Returns the verdict reported for this file. */
    public FileVerdict verdict() {
        return new FileVerdict(path, changed(), appliedRules);
    }
}
