package ai.docsite.bridge.adapter;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.bridge.content.DesiredContent;
import ai.docsite.bridge.diff.RegionStatus;
import ai.docsite.bridge.registry.AdapterKind;
import ai.docsite.bridge.registry.SectionConfig;
import ai.docsite.bridge.util.JacksonUtility;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DocusaurusSidebarAdapterTest {

    private final DocusaurusSidebarAdapter adapter = new DocusaurusSidebarAdapter();

    @Test
    void createsCategoryAndDocEntry() throws Exception {
        SectionConfig section = section(Map.of("doc_id", "architecture/overview"));

        AdapterEvaluation evaluation = adapter.evaluate(section, DesiredContent.empty(),
                Optional.of("{\"docs\": [\"intro\"]}"));

        assertThat(evaluation.status()).isEqualTo(RegionStatus.DRIFT);
        String proposed = evaluation.proposed().orElseThrow();
        assertThat(proposed).endsWith("}\n");
        JsonNode docs = JacksonUtility.getJsonMapper().readTree(proposed).path("docs");
        assertThat(docs.get(0).asText()).isEqualTo("intro");
        JsonNode category = docs.get(1);
        assertThat(category.path("type").asText()).isEqualTo("category");
        assertThat(category.path("label").asText()).isEqualTo("Architecture");
        assertThat(category.path("items").get(0).path("id").asText()).isEqualTo("architecture/overview");
    }

    @Test
    void reusesExistingCategoryAndIsIdempotent() {
        SectionConfig section = section(Map.of("sidebar", "guide", "category", "Design"));
        String current = "{\"guide\": [{\"type\": \"category\", \"label\": \"Design\", \"items\": [\"adr\"]}]}";

        String proposed = adapter.evaluate(section, DesiredContent.empty(), Optional.of(current)).proposed().orElseThrow();
        AdapterEvaluation second = adapter.evaluate(section, DesiredContent.empty(), Optional.of(proposed));

        assertThat(proposed).contains("\"adr\"").contains("\"id\" : \"overview\"");
        assertThat(second.status()).isEqualTo(RegionStatus.MATCH);
    }

    @Test
    void rejectsMalformedSidebar() {
        SectionConfig section = section(Map.of());

        assertThat(adapter.evaluate(section, DesiredContent.empty(), Optional.of("{not json")).status())
                .isEqualTo(RegionStatus.CORRUPTED);
        assertThat(adapter.evaluate(section, DesiredContent.empty(), Optional.of("{\"docs\": {}}")).status())
                .isEqualTo(RegionStatus.CORRUPTED);
        assertThat(adapter.evaluate(section, DesiredContent.empty(), Optional.empty()).status())
                .isEqualTo(RegionStatus.MISSING_FILE);
    }

    private static SectionConfig section(Map<String, String> options) {
        return SectionConfig.external("overview", null, AdapterKind.DOCUSAURUS_SIDEBAR, options);
    }
}
