package ai.docsite.bridge.issue;

import java.util.Locale;

/**
 * Severity attached to a reported issue. Ordered from least to most severe.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public Severity max(Severity other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
