package ai.docsite.bridge.diff;

import ai.docsite.bridge.content.ContentHash;
import ai.docsite.bridge.content.DesiredContent;
import ai.docsite.bridge.marker.DocumentLines;
import ai.docsite.bridge.marker.MarkerScan;
import ai.docsite.bridge.marker.MarkerScanner;
import ai.docsite.bridge.marker.RegionSpan;
import ai.docsite.bridge.registry.SectionConfig;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.eclipse.jgit.diff.DiffAlgorithm;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.diff.EditList;
import org.eclipse.jgit.diff.RawText;
import org.eclipse.jgit.diff.RawTextComparator;

/**
 * Classifies a section's host file against its desired content. Read-only.
 */
public class DiffEngine {

    private final MarkerScanner scanner;

    public DiffEngine() {
        this(new MarkerScanner());
    }

    public DiffEngine(MarkerScanner scanner) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
    }

    /**
     * @param currentText content of the host file, empty when the file does not exist
     */
    public RegionDiagnosis diagnose(SectionConfig section, Path target, DesiredContent desired, Optional<String> currentText) {
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(desired, "desired");
        if (currentText.isEmpty()) {
            ManagedRegion region = new ManagedRegion(section.name(), target, Optional.empty(), null, Optional.empty(),
                    RegionStatus.MISSING_FILE);
            return new RegionDiagnosis(region, desired, Optional.empty(), Optional.empty(), Optional.empty());
        }

        String text = currentText.get();
        Optional<String> fileHash = Optional.of(ContentHash.sha256(text));
        DocumentLines document = DocumentLines.parse(text);
        MarkerScan scan = scanner.scan(document, section.marker());

        switch (scan.kind()) {
            case ABSENT:
                return failed(section, target, desired, fileHash, RegionStatus.MISSING_MARKER, null);
            case DUPLICATE:
                return failed(section, target, desired, fileHash, RegionStatus.DUPLICATE_MARKER, scan.reason());
            case CORRUPTED:
                return failed(section, target, desired, fileHash, RegionStatus.CORRUPTED, scan.reason());
            default:
                break;
        }

        RegionSpan span = scan.span().orElseThrow();
        String inner = document.join(span.innerStart(), span.innerEnd());
        String current = ContentHash.normalize(inner);
        String expected = ContentHash.normalize(desired.content());
        RegionStatus status = current.equals(expected) ? RegionStatus.MATCH : RegionStatus.DRIFT;
        ManagedRegion region = new ManagedRegion(section.name(), target, Optional.of(span), inner,
                Optional.of(ContentHash.sha256(current)), status);
        Optional<RegionDiff> diff = status == RegionStatus.DRIFT ? Optional.of(lineDiff(current, expected)) : Optional.empty();
        return new RegionDiagnosis(region, desired, fileHash, diff, Optional.empty());
    }

    /**
     * Histogram line diff of two normalized texts, with every unchanged line kept as context.
     */
    public RegionDiff lineDiff(String current, String desired) {
        RawText before = rawText(current);
        RawText after = rawText(desired);
        EditList edits = DiffAlgorithm.getAlgorithm(DiffAlgorithm.SupportedAlgorithm.HISTOGRAM)
                .diff(RawTextComparator.DEFAULT, before, after);

        List<DiffLine> lines = new ArrayList<>();
        int cursor = 0;
        for (Edit edit : edits) {
            for (int i = cursor; i < edit.getBeginA(); i++) {
                lines.add(new DiffLine(DiffLine.Type.CONTEXT, before.getString(i)));
            }
            for (int i = edit.getBeginA(); i < edit.getEndA(); i++) {
                lines.add(new DiffLine(DiffLine.Type.REMOVED, before.getString(i)));
            }
            for (int i = edit.getBeginB(); i < edit.getEndB(); i++) {
                lines.add(new DiffLine(DiffLine.Type.ADDED, after.getString(i)));
            }
            cursor = edit.getEndA();
        }
        for (int i = cursor; i < before.size(); i++) {
            lines.add(new DiffLine(DiffLine.Type.CONTEXT, before.getString(i)));
        }
        return new RegionDiff(lines);
    }

    private RegionDiagnosis failed(SectionConfig section, Path target, DesiredContent desired, Optional<String> fileHash,
                                   RegionStatus status, String reason) {
        ManagedRegion region = new ManagedRegion(section.name(), target, Optional.empty(), null, Optional.empty(), status);
        return new RegionDiagnosis(region, desired, fileHash, Optional.empty(), Optional.ofNullable(reason));
    }

    private RawText rawText(String normalized) {
        String text = normalized.isEmpty() ? "" : normalized + "\n";
        return new RawText(text.getBytes(StandardCharsets.UTF_8));
    }
}
