package ai.docsite.bridge.writer;

import ai.docsite.bridge.anchor.AnchorResolver;
import ai.docsite.bridge.anchor.InsertionPoint;
import ai.docsite.bridge.backup.BackupSnapshot;
import ai.docsite.bridge.backup.BackupStore;
import ai.docsite.bridge.content.ContentHash;
import ai.docsite.bridge.diff.RegionDiagnosis;
import ai.docsite.bridge.issue.DocsBridgeException;
import ai.docsite.bridge.issue.IssueCode;
import ai.docsite.bridge.marker.DocumentLines;
import ai.docsite.bridge.marker.MarkerScan;
import ai.docsite.bridge.marker.MarkerScanner;
import ai.docsite.bridge.marker.MarkerSyntax;
import ai.docsite.bridge.marker.RegionSpan;
import ai.docsite.bridge.registry.SectionConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies region mutations: recheck the file against its diagnosis, record a backup, then replace
 * the file atomically. Bytes outside the managed span are never rewritten.
 */
public class ManagedRegionWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManagedRegionWriter.class);

    private final AtomicFileWriter fileWriter;
    private final BackupStore backupStore;
    private final AnchorResolver anchorResolver;
    private final MarkerScanner scanner;

    public ManagedRegionWriter(AtomicFileWriter fileWriter, BackupStore backupStore) {
        this(fileWriter, backupStore, new AnchorResolver(), new MarkerScanner());
    }

    public ManagedRegionWriter(AtomicFileWriter fileWriter, BackupStore backupStore, AnchorResolver anchorResolver,
                               MarkerScanner scanner) {
        this.fileWriter = Objects.requireNonNull(fileWriter, "fileWriter");
        this.backupStore = Objects.requireNonNull(backupStore, "backupStore");
        this.anchorResolver = Objects.requireNonNull(anchorResolver, "anchorResolver");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
    }

    /**
     * Overwrites a drifting span or inserts a missing region, as decided by {@code diagnosis}.
     *
     * @throws DocsBridgeException with {@link IssueCode#CONFLICT} when the file changed since diagnosis
     */
    public WriteOutcome apply(SectionConfig section, Path target, RegionDiagnosis diagnosis) {
        String current = readRequired(section, target);
        verifyUnchanged(section, target, diagnosis.fileHash(), current);
        DocumentLines document = DocumentLines.parse(current);
        String content = diagnosis.desired().content();

        switch (diagnosis.status()) {
            case DRIFT: {
                RegionSpan span = pairedSpan(section, target, document);
                List<String> replacement = MarkerSyntax.contentLines(content);
                String updated = document.replace(span.innerStart(), span.innerEnd(), replacement).render();
                return commit(section, target, current, updated, WriteOutcome.UPDATED);
            }
            case MISSING_MARKER: {
                InsertionPoint point = anchorResolver.resolve(section, target, document);
                List<String> region = anchorResolver.regionLines(point, section.marker(), content);
                String updated = document.insert(point.line(), region).render();
                return commit(section, target, current, updated, WriteOutcome.INSERTED);
            }
            case MATCH:
                return WriteOutcome.noop();
            default:
                throw new IllegalStateException("Cannot write section " + section.name() + " in state "
                        + diagnosis.status().label());
        }
    }

    /**
     * Replaces the whole file, used by external adapters whose payload is a complete document.
     *
     * @param expectedHash hash of the file when its proposed content was computed, empty if it did not exist
     */
    public WriteOutcome replaceFile(SectionConfig section, Path target, Optional<String> expectedHash, String content) {
        Optional<String> current = read(target);
        Optional<String> currentHash = current.map(ContentHash::sha256);
        if (!currentHash.equals(expectedHash)) {
            throw conflict(section, target);
        }
        if (current.isPresent() && current.get().equals(content)) {
            return WriteOutcome.noop();
        }
        BackupSnapshot snapshot = backupStore.record(section.name(), target, current);
        fileWriter.write(target, content);
        LOGGER.info("Wrote {} for section {}", target, section.name());
        return new WriteOutcome(current.isPresent() ? WriteOutcome.UPDATED : WriteOutcome.CREATED, Optional.of(snapshot));
    }

    /**
     * Records a snapshot of the target without modifying it.
     */
    public BackupSnapshot snapshot(SectionConfig section, Path target) {
        return backupStore.record(section.name(), target, read(target));
    }

    /**
     * Restores a snapshot after backing up the current state, deleting the target when the snapshot
     * recorded a missing file.
     */
    public WriteOutcome restore(SectionConfig section, Path target, BackupSnapshot snapshot) {
        Optional<String> current = read(target);
        BackupSnapshot safety = backupStore.record(section.name(), target, current);
        if (snapshot.priorContent().isPresent()) {
            fileWriter.write(target, snapshot.priorContent().get());
            LOGGER.info("Restored {} from backup {}", target, snapshot.id());
            return new WriteOutcome(WriteOutcome.RESTORED, Optional.of(safety));
        }
        fileWriter.delete(target);
        LOGGER.info("Removed {}: backup {} recorded no file", target, snapshot.id());
        return new WriteOutcome(WriteOutcome.DELETED, Optional.of(safety));
    }

    public Optional<String> read(Path target) {
        if (!Files.isRegularFile(target)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(target, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + target, ex);
        }
    }

    private WriteOutcome commit(SectionConfig section, Path target, String current, String updated, String action) {
        if (updated.equals(current)) {
            return WriteOutcome.noop();
        }
        BackupSnapshot snapshot = backupStore.record(section.name(), target, Optional.of(current));
        fileWriter.write(target, updated);
        LOGGER.info("{} managed region {} in {}", capitalize(action), section.marker(), target);
        return new WriteOutcome(action, Optional.of(snapshot));
    }

    private String readRequired(SectionConfig section, Path target) {
        return read(target).orElseThrow(() -> new DocsBridgeException(IssueCode.MISSING_FILE, section.name(),
                target.toString(), "Target file " + target + " does not exist"));
    }

    private void verifyUnchanged(SectionConfig section, Path target, Optional<String> expectedHash, String current) {
        if (expectedHash.isEmpty() || !expectedHash.get().equals(ContentHash.sha256(current))) {
            throw conflict(section, target);
        }
    }

    private RegionSpan pairedSpan(SectionConfig section, Path target, DocumentLines document) {
        MarkerScan scan = scanner.scan(document, section.marker());
        return scan.span().orElseThrow(() -> new DocsBridgeException(IssueCode.CORRUPTED_MARKERS, section.name(),
                target.toString(), "Markers of section " + section.name() + " are no longer paired in " + target));
    }

    private DocsBridgeException conflict(SectionConfig section, Path target) {
        return new DocsBridgeException(IssueCode.CONFLICT, section.name(), target.toString(),
                "Target " + target + " changed since it was diagnosed; refusing to overwrite");
    }

    private static String capitalize(String action) {
        return Character.toUpperCase(action.charAt(0)) + action.substring(1);
    }
}
