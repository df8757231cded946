package patcher.files;

import patcher.exceptions.PatchException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Expands a glob path pattern into the ordered list of files it matches.
 *
 * <p>Patterns are relative to a root directory and use {@code /} between
 * segments. A {@code *} matches within one segment, {@code **} crosses
 * segments. Without {@code **} the walk stops at the pattern's depth.
 * Like shell globbing, entries whose name starts with {@code .} only match
 * when the pattern has a segment starting with {@code .}.
 *
 * <p>Results are sorted by relative path. An empty result is not an error.
 */
public final class FileSetResolver {

    /**
     * Resolves the files under {@code root} matching {@code pattern}.
     *
     * @param root the directory the pattern is relative to
     * @param pattern the glob pattern, e.g. {@code services/*&#47;cmd/*&#47;main.go}
     * @return matching regular files, sorted by relative path
     * @throws PatchException if the root is not a readable directory
     */
    public List<Path> resolve(Path root, String pattern) throws PatchException {
        if (!Files.isDirectory(root)) {
            throw new PatchException("Root is not a directory", root, null, "resolve", null);
        }

        String normalized = pattern.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        String[] segments = normalized.split("/");
        int depth = normalized.contains("**") ? Integer.MAX_VALUE : segments.length;
        boolean matchHidden = Stream.of(segments).anyMatch(s -> s.startsWith("."));
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + normalized);

        try (Stream<Path> walk = Files.walk(root, depth)) {
            return walk
                    .filter(Files::isRegularFile)
                    .map(root::relativize)
                    .filter(rel -> matchHidden || !isHidden(rel))
                    .filter(matcher::matches)
                    .sorted(Comparator.comparing(FileSetResolver::slashed))
                    .map(root::resolve)
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PatchException("Failed to list files", root, null, "resolve", e);
        } catch (UncheckedIOException e) {
            throw new PatchException("Failed to list files", root, null, "resolve", e.getCause());
        }
    }

    private static boolean isHidden(Path relative) {
        for (Path segment : relative) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    private static String slashed(Path relative) {
        return relative.toString().replace('\\', '/');
    }
}
