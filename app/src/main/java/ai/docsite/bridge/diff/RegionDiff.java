package ai.docsite.bridge.diff;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Line diff from the current inner span to the desired content.
 */
public record RegionDiff(List<DiffLine> lines) {

    public RegionDiff {
        lines = List.copyOf(lines);
    }

    public long added() {
        return lines.stream().filter(line -> line.type() == DiffLine.Type.ADDED).count();
    }

    public long removed() {
        return lines.stream().filter(line -> line.type() == DiffLine.Type.REMOVED).count();
    }

    public boolean isEmpty() {
        return added() == 0 && removed() == 0;
    }

    /**
     * Unified-style rendering with full context.
     */
    public String render(String currentLabel, String desiredLabel) {
        String header = "--- " + currentLabel + "\n+++ " + desiredLabel + "\n";
        return header + lines.stream().map(DiffLine::render).collect(Collectors.joining("\n"));
    }
}
