package ai.docsite.bridge.adapter;

import ai.docsite.bridge.diff.RegionStatus;
import ai.docsite.bridge.issue.IssueCode;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of evaluating an external section against its target file.
 *
 * @param proposed complete file content the target should hold, empty when the adapter cannot produce one
 * @param blocker issue preventing a write even though a change is needed
 */
public record AdapterEvaluation(RegionStatus status, Optional<String> proposed, String detail, Optional<IssueCode> blocker) {

    public AdapterEvaluation {
        Objects.requireNonNull(status, "status");
        proposed = proposed == null ? Optional.empty() : proposed;
        detail = detail == null ? "" : detail;
        blocker = blocker == null ? Optional.empty() : blocker;
    }

    public static AdapterEvaluation match(String current, String detail) {
        return new AdapterEvaluation(RegionStatus.MATCH, Optional.of(current), detail, Optional.empty());
    }

    public static AdapterEvaluation drift(String proposed, String detail) {
        return new AdapterEvaluation(RegionStatus.DRIFT, Optional.of(proposed), detail, Optional.empty());
    }

    public static AdapterEvaluation missingFile(String detail) {
        return new AdapterEvaluation(RegionStatus.MISSING_FILE, Optional.empty(), detail, Optional.empty());
    }

    public static AdapterEvaluation corrupted(String detail) {
        return new AdapterEvaluation(RegionStatus.CORRUPTED, Optional.empty(), detail, Optional.of(IssueCode.CORRUPTED_TARGET));
    }

    public boolean writable() {
        return proposed.isPresent() && blocker.isEmpty() && status != RegionStatus.MATCH;
    }
}
