package ai.docsite.bridge.content;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Normalization and hashing shared by every comparison of managed content.
 */
public final class ContentHash {

    private ContentHash() {
    }

    /**
     * Converts CRLF to LF and strips leading and trailing newlines, so comparisons ignore the line
     * ending style and the blank lines hugging the markers.
     */
    public static String normalize(String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        String normalized = content.replace("\r\n", "\n");
        int start = 0;
        int end = normalized.length();
        while (start < end && normalized.charAt(start) == '\n') {
            start++;
        }
        while (end > start && normalized.charAt(end - 1) == '\n') {
            end--;
        }
        return normalized.substring(start, end);
    }

    public static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    public static String normalizedSha256(String content) {
        return sha256(normalize(content));
    }
}
