package ai.docsite.bridge.lifecycle;

import java.util.Locale;

/**
 * Aggregate outcome of one invocation.
 */
public enum RunStatus {
    OK,
    WARNING,
    ERROR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public int exitCode() {
        return this == ERROR ? 1 : 0;
    }
}
