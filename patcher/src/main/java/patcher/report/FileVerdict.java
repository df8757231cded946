package patcher.report;

import java.nio.file.Path;
import java.util.List;

/**
 * Per-file outcome of a run.
 *
 * @param path the file
 * @param changed true if the file content changed
 * @param appliedRules ids of the rules that changed the content, in application order
 */
public record FileVerdict(Path path, boolean changed, List<String> appliedRules) {

    public FileVerdict {
        appliedRules = List.copyOf(appliedRules);
    }

    public static FileVerdict unchanged(Path path) {
        return new FileVerdict(path, false, List.of());
    }
}
