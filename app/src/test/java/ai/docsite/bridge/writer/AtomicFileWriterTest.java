package ai.docsite.bridge.writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AtomicFileWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void createsParentDirectoriesAndWritesContent() throws Exception {
        Path target = tempDir.resolve("docs/adr/index.md");

        new AtomicFileWriter().write(target, "# ADR\n");

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("# ADR\n");
        assertThat(siblings(target.getParent())).containsExactly("index.md");
    }

    @Test
    void failureBeforeRenameLeavesTargetUntouched() throws Exception {
        Path target = tempDir.resolve("overview.md");
        Files.writeString(target, "original\n", StandardCharsets.UTF_8);
        AtomicFileWriter writer = new AtomicFileWriter((temporary, destination) -> {
            assertThat(Files.readString(temporary, StandardCharsets.UTF_8)).isEqualTo("replacement\n");
            throw new IOException("simulated crash");
        });

        Throwable failure = catchThrowable(() -> writer.write(target, "replacement\n"));

        assertThat(failure).isInstanceOf(UncheckedIOException.class).hasMessageContaining("Failed to write");
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("original\n");
        assertThat(siblings(tempDir)).containsExactly("overview.md");
    }

    @Test
    void deleteIgnoresMissingFile() throws Exception {
        Path target = tempDir.resolve("gone.md");
        Files.writeString(target, "x", StandardCharsets.UTF_8);
        AtomicFileWriter writer = new AtomicFileWriter();

        writer.delete(target);
        writer.delete(target);

        assertThat(Files.exists(target)).isFalse();
    }

    private static java.util.List<String> siblings(Path directory) throws IOException {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.map(path -> path.getFileName().toString()).sorted().toList();
        }
    }
}
