package ai.docsite.bridge.diff;

import ai.docsite.bridge.marker.RegionSpan;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Derived view of one section inside its host file. Never persisted.
 *
 * @param innerContent text strictly between the markers, empty unless a single pair was found
 * @param contentHash SHA-256 of the normalized inner content, empty unless a single pair was found
 */
public record ManagedRegion(
        String section,
        Path target,
        Optional<RegionSpan> span,
        String innerContent,
        Optional<String> contentHash,
        RegionStatus status
) {

    public ManagedRegion {
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(status, "status");
        span = span == null ? Optional.empty() : span;
        innerContent = innerContent == null ? "" : innerContent;
        contentHash = contentHash == null ? Optional.empty() : contentHash;
    }
}
