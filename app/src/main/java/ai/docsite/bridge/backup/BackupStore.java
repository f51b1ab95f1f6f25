package ai.docsite.bridge.backup;

import ai.docsite.bridge.content.ContentHash;
import ai.docsite.bridge.util.JacksonUtility;
import ai.docsite.bridge.writer.AtomicFileWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Timestamped, restorable snapshots under {@code <stateDir>/history/<section>/<id>.json}. Snapshots
 * are written atomically and only removed by pruning.
 */
public class BackupStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackupStore.class);

    public static final int DEFAULT_RETENTION = 20;
    private static final String EXTENSION = ".json";

    private final Path historyDirectory;
    private final AtomicFileWriter writer;
    private final Clock clock;
    private final int retention;

    public BackupStore(Path stateDirectory, AtomicFileWriter writer) {
        this(stateDirectory, writer, Clock.systemUTC(), DEFAULT_RETENTION);
    }

    public BackupStore(Path stateDirectory, AtomicFileWriter writer, Clock clock, int retention) {
        this.historyDirectory = Objects.requireNonNull(stateDirectory, "stateDirectory").resolve("history");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (retention < 1) {
            throw new IllegalArgumentException("retention must be positive");
        }
        this.retention = retention;
    }

    /**
     * Persists the current state of {@code target} and prunes the section's older snapshots.
     */
    public BackupSnapshot record(String section, Path target, Optional<String> priorContent) {
        Path directory = historyDirectory.resolve(section);
        Instant timestamp = clock.instant().truncatedTo(ChronoUnit.MICROS);
        BackupSnapshot snapshot = new BackupSnapshot(timestamp, section, target.toString(), priorContent);
        while (Files.exists(directory.resolve(snapshot.id() + EXTENSION))) {
            timestamp = timestamp.plus(1, ChronoUnit.MICROS);
            snapshot = new BackupSnapshot(timestamp, section, target.toString(), priorContent);
        }
        writer.write(directory.resolve(snapshot.id() + EXTENSION), serialize(snapshot));
        LOGGER.info("Recorded backup {} of {} for section {}", snapshot.id(), target, section);
        prune(section);
        return snapshot;
    }

    /**
     * Snapshots of a section, oldest first.
     */
    public List<BackupSnapshot> list(String section) {
        Path directory = historyDirectory.resolve(section);
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<BackupSnapshot> snapshots = new ArrayList<>();
        for (Path file : snapshotFiles(directory)) {
            snapshots.add(read(file));
        }
        snapshots.sort(Comparator.comparing(BackupSnapshot::timestamp));
        return snapshots;
    }

    /**
     * Looks a snapshot up by ISO-8601 instant or compact id.
     */
    public Optional<BackupSnapshot> find(String section, String timestamp) {
        Optional<Instant> instant = parseTimestamp(timestamp);
        if (instant.isEmpty()) {
            return Optional.empty();
        }
        Path file = historyDirectory.resolve(section)
                .resolve(BackupSnapshot.ID_FORMAT.format(instant.get()) + EXTENSION);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    public void prune(String section) {
        Path directory = historyDirectory.resolve(section);
        if (!Files.isDirectory(directory)) {
            return;
        }
        List<Path> files = snapshotFiles(directory);
        int excess = files.size() - retention;
        for (int i = 0; i < excess; i++) {
            LOGGER.debug("Pruning backup {}", files.get(i));
            writer.delete(files.get(i));
        }
    }

    static Optional<Instant> parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        try {
            return Optional.of(Instant.parse(trimmed).truncatedTo(ChronoUnit.MICROS));
        } catch (DateTimeParseException ex) {
            LOGGER.debug("{} is not an ISO-8601 instant, trying compact id", trimmed);
        }
        try {
            return Optional.of(LocalDateTime.parse(trimmed, BackupSnapshot.ID_FORMAT).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ex) {
            LOGGER.debug("{} is not a compact backup id either", trimmed);
            return Optional.empty();
        }
    }

    // Compact ids sort lexicographically in chronological order.
    private List<Path> snapshotFiles(Path directory) {
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                    .filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list backups in " + directory, ex);
        }
    }

    private String serialize(BackupSnapshot snapshot) {
        ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
        node.put("timestamp", snapshot.timestamp().toString());
        node.put("section", snapshot.section());
        node.put("target", snapshot.target());
        node.put("existed", snapshot.existed());
        snapshot.priorContent().ifPresent(content -> {
            node.put("content", content);
            node.put("sha256", ContentHash.sha256(content));
        });
        try {
            return JacksonUtility.getPrettyJsonWriter().writeValueAsString(node) + "\n";
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize backup of " + snapshot.target(), ex);
        }
    }

    private BackupSnapshot read(Path file) {
        try {
            JsonNode node = JacksonUtility.getJsonMapper().readTree(file.toFile());
            Instant timestamp = Instant.parse(node.path("timestamp").asText());
            Optional<String> content = node.path("existed").asBoolean(true) && node.hasNonNull("content")
                    ? Optional.of(node.get("content").asText())
                    : Optional.empty();
            return new BackupSnapshot(timestamp, node.path("section").asText(), node.path("target").asText(), content);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read backup " + file, ex);
        } catch (DateTimeParseException ex) {
            throw new IllegalStateException("Backup " + file + " has an invalid timestamp", ex);
        }
    }
}
