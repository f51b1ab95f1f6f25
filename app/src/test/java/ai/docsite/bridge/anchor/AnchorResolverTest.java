package ai.docsite.bridge.anchor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.docsite.bridge.issue.DocsBridgeException;
import ai.docsite.bridge.issue.IssueCode;
import ai.docsite.bridge.marker.DocumentLines;
import ai.docsite.bridge.registry.AnchorPolicy;
import ai.docsite.bridge.registry.SectionConfig;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class AnchorResolverTest {

    private static final Path TARGET = Path.of("docs/architecture/overview.md");

    private final AnchorResolver resolver = new AnchorResolver();

    @Test
    void insertsAfterHeadingAndFollowingBlankLine() {
        DocumentLines document = DocumentLines.parse("# Title\n\nIntro\n");

        InsertionPoint point = resolver.resolve(section(new AnchorPolicy.AfterHeading("# Title")), TARGET, document);

        assertThat(point).isEqualTo(new InsertionPoint(2, false, true));
    }

    @Test
    void addsBlankLineWhenHeadingIsFollowedByText() {
        DocumentLines document = DocumentLines.parse("# Title\nIntro\n");

        InsertionPoint point = resolver.resolve(section(new AnchorPolicy.AfterHeading(" # Title ")), TARGET, document);

        assertThat(point).isEqualTo(new InsertionPoint(1, true, true));
    }

    @Test
    void headingAtEndOfFileNeedsNoTrailingBlank() {
        DocumentLines document = DocumentLines.parse("# Title\n");

        InsertionPoint point = resolver.resolve(section(new AnchorPolicy.AfterHeading("# Title")), TARGET, document);

        assertThat(point).isEqualTo(new InsertionPoint(1, true, false));
    }

    @Test
    void missingHeadingFailsWithoutFallback() {
        DocumentLines document = DocumentLines.parse("# Other\n");

        DocsBridgeException failure = (DocsBridgeException) catchThrowable(
                () -> resolver.resolve(section(new AnchorPolicy.AfterHeading("# Title")), TARGET, document));

        assertThat(failure.code()).isEqualTo(IssueCode.ANCHOR_NOT_FOUND);
        assertThat(failure.section()).isEqualTo("overview");
    }

    @Test
    void insertsImmediatelyBeforeOtherRegion() {
        DocumentLines document = DocumentLines.parse("# Doc\n\n<!-- agentcontrol:start:other -->\nx\n<!-- agentcontrol:end:other -->\n");

        InsertionPoint point = resolver.resolve(section(new AnchorPolicy.BeforeMarker("other")), TARGET, document);

        assertThat(point).isEqualTo(new InsertionPoint(2, false, false));
    }

    @Test
    void missingMarkerAnchorFails() {
        DocumentLines document = DocumentLines.parse("# Doc\n");

        DocsBridgeException failure = (DocsBridgeException) catchThrowable(
                () -> resolver.resolve(section(new AnchorPolicy.BeforeMarker("other")), TARGET, document));

        assertThat(failure.code()).isEqualTo(IssueCode.ANCHOR_NOT_FOUND);
    }

    @Test
    void appendsWithSingleSeparatingBlankLine() {
        assertThat(resolver.resolve(section(null), TARGET, DocumentLines.parse("text\n")))
                .isEqualTo(new InsertionPoint(1, true, false));
        assertThat(resolver.resolve(section(null), TARGET, DocumentLines.parse("text\n\n")))
                .isEqualTo(new InsertionPoint(2, false, false));
        assertThat(resolver.resolve(section(null), TARGET, DocumentLines.empty()))
                .isEqualTo(new InsertionPoint(0, false, false));
    }

    @Test
    void regionLinesWrapContentInMarkers() {
        assertThat(resolver.regionLines(new InsertionPoint(0, true, true), "m", "a\nb\n"))
                .containsExactly("", "<!-- agentcontrol:start:m -->", "a", "b", "<!-- agentcontrol:end:m -->", "");
    }

    private SectionConfig section(AnchorPolicy anchor) {
        return SectionConfig.managed("overview", "architecture/overview.md", null, anchor);
    }
}
