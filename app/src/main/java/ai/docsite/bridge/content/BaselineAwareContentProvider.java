package ai.docsite.bridge.content;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Overlays adopted baselines on top of the renderer output. A baseline applies only while the
 * renderer still produces the content it was adopted against; once the rendered hash moves on,
 * the renderer wins again.
 */
public class BaselineAwareContentProvider implements DesiredContentProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(BaselineAwareContentProvider.class);

    private final DesiredContentProvider renderer;
    private final BaselineStore baselineStore;

    public BaselineAwareContentProvider(DesiredContentProvider renderer, BaselineStore baselineStore) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.baselineStore = Objects.requireNonNull(baselineStore, "baselineStore");
    }

    @Override
    public Optional<DesiredContent> render(String sectionName) {
        Optional<DesiredContent> rendered = renderer.render(sectionName);
        Optional<AdoptedBaseline> baseline = baselineStore.find(sectionName);
        if (baseline.isEmpty()) {
            return rendered;
        }
        String renderedHash = rendered.map(DesiredContent::hash).orElse(null);
        if (!Objects.equals(renderedHash, baseline.get().rendererHash())) {
            LOGGER.info("Ignoring stale adopted baseline for section {} (renderer output changed since {})",
                    sectionName, baseline.get().adoptedAt());
            return rendered;
        }
        return Optional.of(new DesiredContent(baseline.get().content(), baseline.get().contentHash()));
    }

    /**
     * Renderer output without the baseline overlay; adopt binds new baselines to this hash.
     */
    public Optional<DesiredContent> renderWithoutBaseline(String sectionName) {
        return renderer.render(sectionName);
    }
}
