package ai.docsite.bridge.content;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.bridge.writer.AtomicFileWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BaselineAwareContentProviderTest {

    @TempDir
    Path tempDir;

    private Path rendered;
    private BaselineStore baselines;
    private BaselineAwareContentProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        rendered = Files.createDirectories(tempDir.resolve("rendered"));
        baselines = new BaselineStore(tempDir.resolve("state"), new AtomicFileWriter());
        provider = new BaselineAwareContentProvider(new RenderedDirectoryContentProvider(rendered), baselines);
    }

    @Test
    void returnsRendererOutputWithoutBaseline() throws Exception {
        Files.writeString(rendered.resolve("overview.md"), "generated\n", StandardCharsets.UTF_8);

        assertThat(provider.render("overview")).map(DesiredContent::content).contains("generated\n");
        assertThat(provider.render("missing")).isEmpty();
    }

    @Test
    void baselineWinsWhileRendererOutputIsUnchanged() throws Exception {
        Files.writeString(rendered.resolve("overview.md"), "generated\n", StandardCharsets.UTF_8);
        String rendererHash = provider.renderWithoutBaseline("overview").orElseThrow().hash();
        baselines.save(new AdoptedBaseline("overview", "hand tuned", null, rendererHash, "2026-03-01T00:00:00Z"));

        DesiredContent desired = provider.render("overview").orElseThrow();

        assertThat(desired.content()).isEqualTo("hand tuned");
        assertThat(desired.hash()).isEqualTo(ContentHash.normalizedSha256("hand tuned"));
    }

    @Test
    void staleBaselineIsIgnoredOnceRendererMovesOn() throws Exception {
        Files.writeString(rendered.resolve("overview.md"), "generated\n", StandardCharsets.UTF_8);
        String rendererHash = provider.renderWithoutBaseline("overview").orElseThrow().hash();
        baselines.save(new AdoptedBaseline("overview", "hand tuned", null, rendererHash, "2026-03-01T00:00:00Z"));
        Files.writeString(rendered.resolve("overview.md"), "regenerated\n", StandardCharsets.UTF_8);

        assertThat(provider.render("overview")).map(DesiredContent::content).contains("regenerated\n");
        assertThat(baselines.find("overview")).map(AdoptedBaseline::content).contains("hand tuned");
    }

    @Test
    void hashIgnoresLineEndingsAndHuggingNewlines() {
        assertThat(ContentHash.normalize("\r\n\nline\r\nnext\n\n")).isEqualTo("line\nnext");
        assertThat(ContentHash.normalizedSha256("a\r\nb")).isEqualTo(ContentHash.normalizedSha256("\na\nb\n"));
    }
}
