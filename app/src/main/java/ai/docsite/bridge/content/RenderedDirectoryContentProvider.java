package ai.docsite.bridge.content;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads pre-rendered section content from {@code <directory>/<section>.md}, the hand-off format of
 * the architecture manifest renderer.
 */
public class RenderedDirectoryContentProvider implements DesiredContentProvider {

    private static final String EXTENSION = ".md";

    private final Path directory;

    public RenderedDirectoryContentProvider(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public Optional<DesiredContent> render(String sectionName) {
        Path file = directory.resolve(sectionName + EXTENSION);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(DesiredContent.of(Files.readString(file, StandardCharsets.UTF_8)));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read rendered content: " + file, ex);
        }
    }
}
