package ai.docsite.bridge.diff;

import ai.docsite.bridge.content.DesiredContent;
import java.util.Objects;
import java.util.Optional;

/**
 * Classification result plus what a later write needs: the desired content and the hash of the
 * whole file as it was observed.
 *
 * @param fileHash SHA-256 of the whole host file at diagnosis time, empty when it did not exist
 * @param diff line diff, present only for {@link RegionStatus#DRIFT}
 * @param detail human readable explanation for corrupted or duplicate markers
 */
public record RegionDiagnosis(
        ManagedRegion region,
        DesiredContent desired,
        Optional<String> fileHash,
        Optional<RegionDiff> diff,
        Optional<String> detail
) {

    public RegionDiagnosis {
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(desired, "desired");
        fileHash = fileHash == null ? Optional.empty() : fileHash;
        diff = diff == null ? Optional.empty() : diff;
        detail = detail == null ? Optional.empty() : detail;
    }

    public RegionStatus status() {
        return region.status();
    }
}
