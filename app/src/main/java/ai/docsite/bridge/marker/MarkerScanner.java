package ai.docsite.bridge.marker;

import java.util.ArrayList;
import java.util.List;

/**
 * Locates the marker pair of a token by scanning raw lines.
 *
 * <p>Unbalanced start/end counts classify as {@link MarkerScan.Kind#CORRUPTED}; balanced counts
 * with more than one pair classify as {@link MarkerScan.Kind#DUPLICATE}. A single pair whose end
 * precedes its start is corrupted as well.</p>
 */
public class MarkerScanner {

    public MarkerScan scan(DocumentLines document, String marker) {
        List<Integer> starts = new ArrayList<>();
        List<Integer> ends = new ArrayList<>();
        for (int i = 0; i < document.size(); i++) {
            String line = document.line(i);
            if (MarkerSyntax.isStart(line, marker)) {
                starts.add(i);
            } else if (MarkerSyntax.isEnd(line, marker)) {
                ends.add(i);
            }
        }

        if (starts.isEmpty() && ends.isEmpty()) {
            return new MarkerScan(MarkerScan.Kind.ABSENT, marker, starts, ends, null);
        }
        if (starts.size() != ends.size()) {
            return new MarkerScan(MarkerScan.Kind.CORRUPTED, marker, starts, ends,
                    "unbalanced markers: " + starts.size() + " start, " + ends.size() + " end");
        }
        if (starts.size() > 1) {
            return new MarkerScan(MarkerScan.Kind.DUPLICATE, marker, starts, ends,
                    starts.size() + " marker pairs found, expected exactly one");
        }
        if (ends.get(0) < starts.get(0)) {
            return new MarkerScan(MarkerScan.Kind.CORRUPTED, marker, starts, ends,
                    "end marker on line " + (ends.get(0) + 1) + " precedes start marker on line " + (starts.get(0) + 1));
        }
        return new MarkerScan(MarkerScan.Kind.PAIRED, marker, starts, ends, null);
    }
}
