package ai.docsite.bridge.marker;

/**
 * Zero-based line span of a managed region, inclusive of both marker lines.
 */
public record RegionSpan(int startLine, int endLine) {

    public RegionSpan {
        if (startLine < 0 || endLine <= startLine) {
            throw new IllegalArgumentException("Invalid region span " + startLine + ".." + endLine);
        }
    }

    public int innerStart() {
        return startLine + 1;
    }

    /**
     * Exclusive end of the inner content.
     */
    public int innerEnd() {
        return endLine;
    }
}
