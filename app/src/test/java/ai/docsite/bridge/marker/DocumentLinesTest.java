package ai.docsite.bridge.marker;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentLinesTest {

    @Test
    void rendersUnmodifiedDocumentByteForByte() {
        String text = "# Title\r\nmixed\nendings\r\nno trailing newline";

        DocumentLines document = DocumentLines.parse(text);

        assertThat(document.size()).isEqualTo(4);
        assertThat(document.line(0)).isEqualTo("# Title");
        assertThat(document.render()).isEqualTo(text);
    }

    @Test
    void usesDominantSeparatorForNewLines() {
        DocumentLines document = DocumentLines.parse("a\r\nb\r\nc\n");

        String rendered = document.insert(1, List.of("x")).render();

        assertThat(document.lineSeparator()).isEqualTo("\r\n");
        assertThat(rendered).isEqualTo("a\r\nx\r\nb\r\nc\n");
    }

    @Test
    void appendingAfterUnterminatedLineTerminatesIt() {
        DocumentLines document = DocumentLines.parse("last");

        String rendered = document.insert(1, List.of("next")).render();

        assertThat(rendered).isEqualTo("last\nnext\n");
    }

    @Test
    void replacingUnterminatedTailKeepsItUnterminated() {
        DocumentLines document = DocumentLines.parse("keep\nold");

        String rendered = document.replace(1, 2, List.of("new", "lines")).render();

        assertThat(rendered).isEqualTo("keep\nnew\nlines");
    }

    @Test
    void joinsRangeWithLineFeeds() {
        DocumentLines document = DocumentLines.parse("a\r\nb\r\nc\r\n");

        assertThat(document.join(0, 2)).isEqualTo("a\nb");
        assertThat(document.join(1, 1)).isEmpty();
    }

    @Test
    void emptyTextHasNoLines() {
        DocumentLines document = DocumentLines.parse("");

        assertThat(document.isEmpty()).isTrue();
        assertThat(document.endsWithBlankLine()).isFalse();
        assertThat(document.render()).isEmpty();
    }
}
