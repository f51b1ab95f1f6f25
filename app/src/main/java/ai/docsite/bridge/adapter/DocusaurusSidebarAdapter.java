package ai.docsite.bridge.adapter;

import ai.docsite.bridge.content.DesiredContent;
import ai.docsite.bridge.registry.AdapterKind;
import ai.docsite.bridge.registry.SectionConfig;
import ai.docsite.bridge.util.JacksonUtility;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Optional;

/**
 * Keeps a {@code {type: doc, id}} item inside a category of a Docusaurus sidebar JSON file.
 */
public class DocusaurusSidebarAdapter implements ExternalAdapter {

    static final String DEFAULT_SIDEBAR = "docs";
    static final String DEFAULT_CATEGORY = "Architecture";

    @Override
    public AdapterKind kind() {
        return AdapterKind.DOCUSAURUS_SIDEBAR;
    }

    @Override
    public String defaultTarget() {
        return "sidebars.json";
    }

    @Override
    public AdapterEvaluation evaluate(SectionConfig section, DesiredContent desired, Optional<String> currentText) {
        if (currentText.isEmpty()) {
            return AdapterEvaluation.missingFile("Docusaurus sidebar file not found");
        }
        ObjectMapper mapper = JacksonUtility.getJsonMapper();
        JsonNode root;
        try {
            root = currentText.get().isBlank() ? mapper.createObjectNode() : mapper.readTree(currentText.get());
        } catch (JsonProcessingException ex) {
            return AdapterEvaluation.corrupted("Sidebar is not valid JSON: " + ex.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return AdapterEvaluation.corrupted("Sidebar must be a JSON object");
        }
        ObjectNode sidebar = (ObjectNode) root;
        String sidebarKey = section.option("sidebar", DEFAULT_SIDEBAR);
        String category = section.option("category", DEFAULT_CATEGORY);
        String docId = section.option("doc_id", section.name());

        JsonNode entriesNode = sidebar.get(sidebarKey);
        if (entriesNode != null && !entriesNode.isArray()) {
            return AdapterEvaluation.corrupted("Sidebar entries of '" + sidebarKey + "' must be a list");
        }
        ArrayNode entries = entriesNode == null ? sidebar.putArray(sidebarKey) : (ArrayNode) entriesNode;

        ObjectNode categoryEntry = null;
        for (JsonNode item : entries) {
            if (item.isObject() && category.equals(item.path("label").asText(null))) {
                categoryEntry = (ObjectNode) item;
                break;
            }
        }
        if (categoryEntry == null) {
            categoryEntry = entries.addObject();
            categoryEntry.put("type", "category");
            categoryEntry.put("label", category);
            categoryEntry.putArray("items");
        }
        JsonNode itemsNode = categoryEntry.get("items");
        if (itemsNode != null && !itemsNode.isArray()) {
            return AdapterEvaluation.corrupted("Category '" + category + "' items must be a list");
        }
        ArrayNode items = itemsNode == null ? categoryEntry.putArray("items") : (ArrayNode) itemsNode;

        ObjectNode docEntry = mapper.createObjectNode().put("type", "doc").put("id", docId);
        for (JsonNode item : items) {
            if (item.equals(docEntry)) {
                return AdapterEvaluation.match(currentText.get(), "doc '" + docId + "' listed under '" + category + "'");
            }
        }
        items.add(docEntry);
        try {
            String proposed = JacksonUtility.getPrettyJsonWriter().writeValueAsString(sidebar) + "\n";
            return AdapterEvaluation.drift(proposed, "doc '" + docId + "' missing from '" + category + "'");
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize sidebar", ex);
        }
    }
}
