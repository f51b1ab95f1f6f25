package ai.docsite.bridge.registry;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Immutable declaration of one documentation section.
 */
public record SectionConfig(
        String name,
        String target,
        String marker,
        SectionMode mode,
        AnchorPolicy anchor,
        Optional<AdapterKind> adapter,
        Map<String, String> options
) {

    public static final String MAX_BYTES_OPTION = "max_bytes";

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9._-]+");

    public SectionConfig {
        name = requireNonBlank(name, "name");
        if (!isValidName(name)) {
            throw new IllegalArgumentException("name '" + name + "' must match [A-Za-z0-9._-]+ and must not be . or ..");
        }
        Objects.requireNonNull(mode, "mode");
        marker = marker == null || marker.isBlank() ? defaultMarker(name) : marker.trim();
        anchor = anchor == null ? AnchorPolicy.APPEND_END : anchor;
        adapter = adapter == null ? Optional.empty() : adapter;
        options = options == null ? Map.of() : Map.copyOf(options);
        parseMaxBytes(options.get(MAX_BYTES_OPTION));
        if (mode == SectionMode.MANAGED) {
            target = requireNonBlank(target, "target");
            if (adapter.isPresent()) {
                throw new IllegalArgumentException("adapter is only allowed when mode is external");
            }
        } else if (adapter.isEmpty()) {
            throw new IllegalArgumentException("adapter is required when mode is external");
        }
    }

    public static SectionConfig managed(String name, String target, String marker, AnchorPolicy anchor) {
        return new SectionConfig(name, target, marker, SectionMode.MANAGED, anchor, Optional.empty(), Map.of());
    }

    public static SectionConfig external(String name, String target, AdapterKind adapter, Map<String, String> options) {
        return new SectionConfig(name, target, null, SectionMode.EXTERNAL, null, Optional.of(adapter), options);
    }

    /**
     * Section names become file names under the state and content directories.
     */
    public static boolean isValidName(String name) {
        return name != null && NAME.matcher(name).matches() && !name.equals(".") && !name.equals("..");
    }

    public static String defaultMarker(String name) {
        return "agentcontrol-" + name;
    }

    public boolean isExternal() {
        return mode == SectionMode.EXTERNAL;
    }

    /**
     * Target as written in the registry; external sections may leave it to the adapter.
     */
    public Optional<String> declaredTarget() {
        return Optional.ofNullable(target);
    }

    public String option(String key, String defaultValue) {
        String value = options.get(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    /**
     * Size budget from the {@code max_bytes} option, empty when the option is not set.
     */
    public OptionalLong maxBytes() {
        return parseMaxBytes(options.get(MAX_BYTES_OPTION));
    }

    private static OptionalLong parseMaxBytes(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalLong.empty();
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(MAX_BYTES_OPTION + " must be a positive integer: " + raw, ex);
        }
        if (value <= 0) {
            throw new IllegalArgumentException(MAX_BYTES_OPTION + " must be a positive integer: " + raw);
        }
        return OptionalLong.of(value);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }
}
