package ai.docsite.bridge.registry;

import java.util.Locale;

/**
 * How a section is materialized: as a marker-delimited region of a Markdown file, or through an
 * external adapter.
 */
public enum SectionMode {
    MANAGED,
    EXTERNAL;

    public static SectionMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return MANAGED;
        }
        for (SectionMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
