package ai.docsite.bridge.writer;

import ai.docsite.bridge.backup.BackupSnapshot;
import java.util.Optional;

/**
 * What a mutating call did to a host file.
 *
 * @param action {@code noop}, {@code updated}, {@code inserted}, {@code created}, {@code restored} or {@code deleted}
 * @param backup snapshot recorded before the write, empty for no-ops
 */
public record WriteOutcome(String action, Optional<BackupSnapshot> backup) {

    public static final String NOOP = "noop";
    public static final String UPDATED = "updated";
    public static final String INSERTED = "inserted";
    public static final String CREATED = "created";
    public static final String RESTORED = "restored";
    public static final String DELETED = "deleted";

    public WriteOutcome {
        backup = backup == null ? Optional.empty() : backup;
    }

    public static WriteOutcome noop() {
        return new WriteOutcome(NOOP, Optional.empty());
    }

    public boolean changed() {
        return !NOOP.equals(action);
    }
}
