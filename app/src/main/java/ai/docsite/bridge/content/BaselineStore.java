package ai.docsite.bridge.content;

import ai.docsite.bridge.util.JacksonUtility;
import ai.docsite.bridge.writer.AtomicFileWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Persists adopted baselines as {@code <stateDir>/baselines/<section>.json}.
 */
public class BaselineStore {

    private final Path directory;
    private final AtomicFileWriter writer;

    public BaselineStore(Path stateDirectory, AtomicFileWriter writer) {
        this.directory = Objects.requireNonNull(stateDirectory, "stateDirectory").resolve("baselines");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    public Optional<AdoptedBaseline> find(String section) {
        Path file = fileFor(section);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(JacksonUtility.getJsonMapper().readValue(file.toFile(), AdoptedBaseline.class));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read adopted baseline: " + file, ex);
        }
    }

    public void save(AdoptedBaseline baseline) {
        try {
            String json = JacksonUtility.getPrettyJsonWriter().writeValueAsString(baseline);
            writer.write(fileFor(baseline.section()), json + "\n");
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize baseline for " + baseline.section(), ex);
        }
    }

    private Path fileFor(String section) {
        return directory.resolve(section + ".json");
    }
}
