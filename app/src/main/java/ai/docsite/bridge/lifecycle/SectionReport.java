package ai.docsite.bridge.lifecycle;

import ai.docsite.bridge.backup.BackupSnapshot;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-section line of a run report. Fields that do not apply to a command are {@code null}.
 *
 * @param status classification observed before any action, or {@code error}
 * @param action what the command did: {@code noop}, {@code updated}, {@code inserted}, {@code created},
 *               {@code adopted}, {@code restored}, {@code deleted} or {@code skipped}
 */
public record SectionReport(
        String name,
        String status,
        String mode,
        String target,
        String marker,
        Map<String, String> anchor,
        String adapter,
        String action,
        String backup,
        String contentHash,
        String expectedHash,
        String diff,
        String detail,
        List<BackupSnapshot> snapshots
) {

    public static final String ERROR = "error";
    public static final String SKIPPED = "skipped";
    public static final String ADOPTED = "adopted";

    public SectionReport {
        Objects.requireNonNull(name, "name");
        anchor = anchor == null ? null : Map.copyOf(anchor);
        snapshots = snapshots == null ? null : List.copyOf(snapshots);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String status;
        private String mode;
        private String target;
        private String marker;
        private Map<String, String> anchor;
        private String adapter;
        private String action;
        private String backup;
        private String contentHash;
        private String expectedHash;
        private String diff;
        private String detail;
        private List<BackupSnapshot> snapshots;

        private Builder(String name) {
            this.name = name;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder mode(String mode) {
            this.mode = mode;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder marker(String marker) {
            this.marker = marker;
            return this;
        }

        public Builder anchor(Map<String, String> anchor) {
            this.anchor = anchor;
            return this;
        }

        public Builder adapter(String adapter) {
            this.adapter = adapter;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder backup(String backup) {
            this.backup = backup;
            return this;
        }

        public Builder contentHash(String contentHash) {
            this.contentHash = contentHash;
            return this;
        }

        public Builder expectedHash(String expectedHash) {
            this.expectedHash = expectedHash;
            return this;
        }

        public Builder diff(String diff) {
            this.diff = diff;
            return this;
        }

        public Builder detail(String detail) {
            this.detail = detail;
            return this;
        }

        public Builder snapshots(List<BackupSnapshot> snapshots) {
            this.snapshots = snapshots;
            return this;
        }

        public SectionReport build() {
            return new SectionReport(name, status, mode, target, marker, anchor, adapter, action, backup,
                    contentHash, expectedHash, diff, detail, snapshots);
        }
    }
}
