package ai.docsite.bridge.registry;

import java.util.Map;
import java.util.Objects;

/**
 * Where a managed region is created the first time it is materialized.
 */
public interface AnchorPolicy {

    AppendEnd APPEND_END = new AppendEnd();

    /**
     * Description used in listings and JSON reports.
     */
    Map<String, String> describe();

    /**
     * Insert right after the first line equal to {@code heading} (compared trimmed).
     */
    record AfterHeading(String heading) implements AnchorPolicy {
        public AfterHeading {
            Objects.requireNonNull(heading, "heading");
            heading = heading.trim();
            if (heading.isEmpty()) {
                throw new IllegalArgumentException("heading must not be blank");
            }
        }

        @Override
        public Map<String, String> describe() {
            return Map.of("type", "insert_after_heading", "value", heading);
        }
    }

    /**
     * Insert right before the start marker of another managed region.
     */
    record BeforeMarker(String token) implements AnchorPolicy {
        public BeforeMarker {
            Objects.requireNonNull(token, "token");
            token = token.trim();
            if (token.isEmpty()) {
                throw new IllegalArgumentException("token must not be blank");
            }
        }

        @Override
        public Map<String, String> describe() {
            return Map.of("type", "insert_before_marker", "value", token);
        }
    }

    /**
     * Append at the end of the file.
     */
    record AppendEnd() implements AnchorPolicy {
        @Override
        public Map<String, String> describe() {
            return Map.of("type", "append");
        }
    }
}
