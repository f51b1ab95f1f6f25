package ai.docsite.bridge.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces whole files through a temporary sibling and a rename, so a reader sees either the old
 * or the new content and never a partial write.
 */
public class AtomicFileWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(AtomicFileWriter.class);

    /**
     * Invoked after the temporary file is fully written and before it is renamed over the target.
     */
    @FunctionalInterface
    public interface CommitHook {
        CommitHook NONE = (temporary, target) -> { };

        void beforeRename(Path temporary, Path target) throws IOException;
    }

    private final CommitHook commitHook;

    public AtomicFileWriter() {
        this(CommitHook.NONE);
    }

    public AtomicFileWriter(CommitHook commitHook) {
        this.commitHook = Objects.requireNonNull(commitHook, "commitHook");
    }

    public void write(Path target, String content) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(content, "content");
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temporary = null;
        try {
            Files.createDirectories(directory);
            temporary = Files.createTempFile(directory, "." + absolute.getFileName() + ".", ".tmp");
            copyPermissions(absolute, temporary);
            writeFully(temporary, content);
            commitHook.beforeRename(temporary, absolute);
            move(temporary, absolute);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + absolute, ex);
        } finally {
            deleteQuietly(temporary);
        }
    }

    public void delete(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to delete " + target, ex);
        }
    }

    private void writeFully(Path temporary, String content) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
        try (FileChannel channel = FileChannel.open(temporary, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private void move(Path temporary, Path target) throws IOException {
        try {
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            LOGGER.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void copyPermissions(Path source, Path temporary) throws IOException {
        if (!Files.exists(source)) {
            return;
        }
        try {
            Files.setPosixFilePermissions(temporary, Files.getPosixFilePermissions(source));
        } catch (UnsupportedOperationException ex) {
            LOGGER.debug("POSIX permissions unsupported for {}", source);
        }
    }

    private void deleteQuietly(Path temporary) {
        if (temporary == null) {
            return;
        }
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException ex) {
            LOGGER.warn("Failed to remove temporary file {}: {}", temporary, ex.getMessage());
        }
    }
}
