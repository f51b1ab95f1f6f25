package ai.docsite.bridge.marker;

import ai.docsite.bridge.content.ContentHash;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Textual contract of a managed region: one start line and one end line carrying the marker token.
 *
 * <p>Marker lines are matched on their trimmed text, line by line. Lines inside fenced code blocks
 * are not treated specially.</p>
 */
public final class MarkerSyntax {

    private static final String START_TEMPLATE = "<!-- agentcontrol:start:%s -->";
    private static final String END_TEMPLATE = "<!-- agentcontrol:end:%s -->";
    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9._-]+");

    private MarkerSyntax() {
    }

    public static boolean isValidToken(String marker) {
        return marker != null && TOKEN.matcher(marker).matches();
    }

    public static String startLine(String marker) {
        return String.format(START_TEMPLATE, marker);
    }

    public static String endLine(String marker) {
        return String.format(END_TEMPLATE, marker);
    }

    public static boolean isStart(String line, String marker) {
        return line.trim().equals(startLine(marker));
    }

    public static boolean isEnd(String line, String marker) {
        return line.trim().equals(endLine(marker));
    }

    /**
     * Splits normalized content into region lines. Empty content yields no lines.
     */
    public static List<String> contentLines(String content) {
        String normalized = ContentHash.normalize(content);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return List.of(normalized.split("\n", -1));
    }

    public static List<String> wrap(String marker, String content) {
        List<String> lines = new ArrayList<>();
        lines.add(startLine(marker));
        lines.addAll(contentLines(content));
        lines.add(endLine(marker));
        return lines;
    }
}
