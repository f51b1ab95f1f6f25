package ai.docsite.bridge.diff;

import ai.docsite.bridge.issue.IssueCode;
import java.util.Optional;

/**
 * Classification of a section's on-disk state against its desired content.
 */
public enum RegionStatus {
    MATCH("match", null),
    DRIFT("drift", IssueCode.DRIFT),
    MISSING_FILE("missing_file", IssueCode.MISSING_FILE),
    MISSING_MARKER("missing_marker", IssueCode.MISSING_MARKER),
    DUPLICATE_MARKER("duplicate_marker", IssueCode.DUPLICATE_MARKER),
    CORRUPTED("corrupted", IssueCode.CORRUPTED_MARKERS);

    private final String label;
    private final IssueCode issueCode;

    RegionStatus(String label, IssueCode issueCode) {
        this.label = label;
        this.issueCode = issueCode;
    }

    public String label() {
        return label;
    }

    public Optional<IssueCode> issueCode() {
        return Optional.ofNullable(issueCode);
    }

    /**
     * States repair can act on by itself.
     */
    public boolean isRepairable() {
        return this == DRIFT || this == MISSING_MARKER;
    }
}
