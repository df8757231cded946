package patcher.files;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads and writes whole file contents.
 *
 * @see FileSystemContentStore
 */
public interface ContentStore {

    /**
     * Reads the complete content of a file.
     *
     * @param path the file
     * @return the file content
     * @throws IOException if the file cannot be read
     */
    String read(Path path) throws IOException;

    /**
     * Replaces the complete content of a file.
     *
     * @param path the file
     * @param content the new content
     * @throws IOException if the file cannot be written
     */
    void write(Path path, String content) throws IOException;
}
