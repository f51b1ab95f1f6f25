package ai.docsite.bridge.content;

import java.util.Objects;

/**
 * Generated payload a section should contain. Opaque to the engine apart from its hash.
 */
public record DesiredContent(String content, String hash) {

    public DesiredContent {
        Objects.requireNonNull(content, "content");
        hash = hash == null || hash.isBlank() ? ContentHash.normalizedSha256(content) : hash;
    }

    public static DesiredContent of(String content) {
        return new DesiredContent(content, null);
    }

    public static DesiredContent empty() {
        return of("");
    }
}
