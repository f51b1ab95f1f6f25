package ai.docsite.bridge.marker;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MarkerScannerTest {

    private static final String MARKER = "agentcontrol-architecture-overview";
    private static final String START = "<!-- agentcontrol:start:" + MARKER + " -->";
    private static final String END = "<!-- agentcontrol:end:" + MARKER + " -->";

    private final MarkerScanner scanner = new MarkerScanner();

    @Test
    void findsSinglePair() {
        MarkerScan scan = scan("# Doc\n" + START + "\nbody\n" + END + "\ntail\n");

        assertThat(scan.kind()).isEqualTo(MarkerScan.Kind.PAIRED);
        assertThat(scan.span()).contains(new RegionSpan(1, 3));
    }

    @Test
    void matchesTrimmedMarkerLines() {
        MarkerScan scan = scan("  " + START + "  \n\t" + END + "\n");

        assertThat(scan.kind()).isEqualTo(MarkerScan.Kind.PAIRED);
    }

    @Test
    void reportsAbsentWhenNoMarkerLine() {
        MarkerScan scan = scan("# Doc\n<!-- agentcontrol:start:other -->\n");

        assertThat(scan.kind()).isEqualTo(MarkerScan.Kind.ABSENT);
        assertThat(scan.span()).isEmpty();
    }

    @Test
    void twoStartsWithoutEndAreCorrupted() {
        MarkerScan scan = scan(START + "\na\n" + START + "\nb\n");

        assertThat(scan.kind()).isEqualTo(MarkerScan.Kind.CORRUPTED);
        assertThat(scan.reason()).contains("2 start, 0 end");
    }

    @Test
    void balancedRepeatedPairsAreDuplicates() {
        MarkerScan scan = scan(START + "\na\n" + END + "\n" + START + "\nb\n" + END + "\n");

        assertThat(scan.kind()).isEqualTo(MarkerScan.Kind.DUPLICATE);
        assertThat(scan.startLines()).containsExactly(0, 3);
    }

    @Test
    void endBeforeStartIsCorrupted() {
        MarkerScan scan = scan(END + "\nbody\n" + START + "\n");

        assertThat(scan.kind()).isEqualTo(MarkerScan.Kind.CORRUPTED);
        assertThat(scan.reason()).contains("precedes");
    }

    @Test
    void markersInsideCodeFencesStillCount() {
        MarkerScan scan = scan("```\n" + START + "\n```\n");

        assertThat(scan.kind()).isEqualTo(MarkerScan.Kind.CORRUPTED);
    }

    private MarkerScan scan(String text) {
        return scanner.scan(DocumentLines.parse(text), MARKER);
    }
}
