package ai.docsite.bridge.content;

import java.util.Objects;

/**
 * Content captured from disk by {@code adopt}, bound to the renderer output it replaced.
 */
public record AdoptedBaseline(String section, String content, String contentHash, String rendererHash, String adoptedAt) {

    public AdoptedBaseline {
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(content, "content");
        contentHash = contentHash == null ? ContentHash.normalizedSha256(content) : contentHash;
    }
}
