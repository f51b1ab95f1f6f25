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
 * Keeps a {@code title: doc} entry in the {@code nav} list of {@code mkdocs.yml}.
 */
public class MkDocsNavAdapter implements ExternalAdapter {

    static final String DEFAULT_DOC = "architecture/overview.md";

    @Override
    public AdapterKind kind() {
        return AdapterKind.MKDOCS_NAV;
    }

    @Override
    public String defaultTarget() {
        return "mkdocs.yml";
    }

    @Override
    public AdapterEvaluation evaluate(SectionConfig section, DesiredContent desired, Optional<String> currentText) {
        if (currentText.isEmpty()) {
            return AdapterEvaluation.missingFile("MkDocs configuration file not found");
        }
        ObjectMapper mapper = JacksonUtility.getYamlMapper();
        JsonNode root;
        try {
            root = currentText.get().isBlank() ? mapper.createObjectNode() : mapper.readTree(currentText.get());
        } catch (JsonProcessingException ex) {
            return AdapterEvaluation.corrupted("mkdocs.yml is not valid YAML: " + ex.getOriginalMessage());
        }
        if (root == null || root.isNull() || root.isMissingNode()) {
            root = mapper.createObjectNode();
        }
        if (!root.isObject()) {
            return AdapterEvaluation.corrupted("mkdocs.yml must be a mapping");
        }
        ObjectNode document = (ObjectNode) root;
        JsonNode navNode = document.get("nav");
        if (navNode != null && !navNode.isNull() && !navNode.isArray()) {
            return AdapterEvaluation.corrupted("MkDocs nav must be a list");
        }
        ArrayNode nav = navNode == null || navNode.isNull() ? document.putArray("nav") : (ArrayNode) navNode;

        String title = section.option("title", section.name());
        String doc = section.option("doc", DEFAULT_DOC);
        for (JsonNode item : nav) {
            if (item.isObject() && item.has(title)) {
                if (item.get(title).isTextual() && item.get(title).asText().equals(doc)) {
                    return AdapterEvaluation.match(currentText.get(), "nav entry '" + title + "' present");
                }
                ((ObjectNode) item).put(title, doc);
                return AdapterEvaluation.drift(write(mapper, document), "nav entry '" + title + "' points elsewhere");
            }
        }

        ObjectNode entry = mapper.createObjectNode().put(title, doc);
        nav.insert(insertIndex(nav, section.option("insert_after", null)), entry);
        return AdapterEvaluation.drift(write(mapper, document), "nav entry '" + title + "' missing");
    }

    private int insertIndex(ArrayNode nav, String insertAfter) {
        if (insertAfter == null) {
            return nav.size();
        }
        for (int i = 0; i < nav.size(); i++) {
            JsonNode item = nav.get(i);
            if (item.isObject() && item.has(insertAfter) || item.isTextual() && item.asText().equals(insertAfter)) {
                return i + 1;
            }
        }
        return nav.size();
    }

    private String write(ObjectMapper mapper, ObjectNode document) {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize mkdocs.yml", ex);
        }
    }
}
