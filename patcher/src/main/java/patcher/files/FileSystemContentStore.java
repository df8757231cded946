package patcher.files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * {@link ContentStore} backed by the default filesystem.
 *
 * <p>Writes go to a temporary sibling file that is then moved over the target,
 * atomically where the filesystem supports it. POSIX permissions of the
 * original file are carried over to the replacement.
 */
public final class FileSystemContentStore implements ContentStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemContentStore.class);

    private final Charset charset;

    public FileSystemContentStore() {
        this(StandardCharsets.UTF_8);
    }

    public FileSystemContentStore(Charset charset) {
        this.charset = charset;
    }

    @Override
    public String read(Path path) throws IOException {
        return Files.readString(path, charset);
    }

    @Override
    public void write(Path path, String content) throws IOException {
        Path dir = path.toAbsolutePath().getParent();
        Path tmp = Files.createTempFile(dir, "." + path.getFileName(), ".tmp");
        try {
            Files.writeString(tmp, content, charset);
            copyPermissions(path, tmp);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, replacing", path);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void copyPermissions(Path from, Path to) throws IOException {
        if (Files.exists(from)
                && FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(to, Files.getPosixFilePermissions(from));
        }
    }
}
