package ai.docsite.bridge.backup;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Whole-file state of a section's target captured right before a mutating write.
 *
 * @param priorContent file content, empty when the file did not exist
 */
public record BackupSnapshot(Instant timestamp, String section, String target, Optional<String> priorContent) {

    static final DateTimeFormatter ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSSSSS'Z'").withZone(ZoneOffset.UTC);

    public BackupSnapshot {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(target, "target");
        timestamp = timestamp.truncatedTo(ChronoUnit.MICROS);
        priorContent = priorContent == null ? Optional.empty() : priorContent;
    }

    public boolean existed() {
        return priorContent.isPresent();
    }

    /**
     * Compact identifier, also the snapshot's file name.
     */
    public String id() {
        return ID_FORMAT.format(timestamp);
    }
}
