package ai.docsite.bridge.marker;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of scanning a document for the marker lines of one token.
 */
public record MarkerScan(Kind kind, String marker, List<Integer> startLines, List<Integer> endLines, String reason) {

    public enum Kind {
        ABSENT,
        PAIRED,
        DUPLICATE,
        CORRUPTED
    }

    public MarkerScan {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(marker, "marker");
        startLines = List.copyOf(startLines);
        endLines = List.copyOf(endLines);
    }

    public Optional<RegionSpan> span() {
        if (kind != Kind.PAIRED) {
            return Optional.empty();
        }
        return Optional.of(new RegionSpan(startLines.get(0), endLines.get(0)));
    }
}
