package ai.docsite.bridge.adapter;

import ai.docsite.bridge.content.ContentHash;
import ai.docsite.bridge.content.DesiredContent;
import ai.docsite.bridge.diff.RegionStatus;
import ai.docsite.bridge.issue.DocsBridgeException;
import ai.docsite.bridge.issue.IssueCode;
import ai.docsite.bridge.registry.AdapterKind;
import ai.docsite.bridge.registry.SectionConfig;
import ai.docsite.bridge.registry.SectionRegistry;
import ai.docsite.bridge.util.JacksonUtility;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds the JSON payload of a Confluence page update. Nothing is sent over the network; the payload
 * file is picked up by a separate publishing step.
 */
public class ConfluencePageAdapter implements ExternalAdapter {

    static final long DEFAULT_MAX_BYTES = 1_048_576L;
    static final String REPRESENTATION = "storage";

    @Override
    public AdapterKind kind() {
        return AdapterKind.CONFLUENCE_PAGE;
    }

    @Override
    public String defaultTarget() {
        return "confluence";
    }

    @Override
    public boolean requiresContent() {
        return true;
    }

    @Override
    public Path resolveTarget(SectionConfig section, SectionRegistry registry, Path stateDirectory) {
        return registry.targetPath(section)
                .orElseGet(() -> stateDirectory.resolve(defaultTarget()).resolve(slug(section) + ".json").normalize());
    }

    @Override
    public AdapterEvaluation evaluate(SectionConfig section, DesiredContent desired, Optional<String> currentText) {
        ObjectMapper mapper = JacksonUtility.getJsonMapper();
        String body = ContentHash.normalize(desired.content());
        String contentHash = ContentHash.sha256(body);

        Optional<JsonNode> existing = Optional.empty();
        if (currentText.isPresent()) {
            try {
                JsonNode node = mapper.readTree(currentText.get());
                if (node == null || !node.isObject()) {
                    return AdapterEvaluation.corrupted("Confluence payload must be a JSON object");
                }
                existing = Optional.of(node);
            } catch (JsonProcessingException ex) {
                return AdapterEvaluation.corrupted("Confluence payload is not valid JSON: " + ex.getOriginalMessage());
            }
        }

        int previousVersion = existing.map(node -> node.path("version").path("number").asInt(0)).orElse(0);
        boolean contentChanged = existing
                .map(node -> !contentHash.equals(node.path("version").path("contentHash").asText(null)))
                .orElse(true);
        int version = contentChanged ? previousVersion + 1 : Math.max(previousVersion, 1);

        ObjectNode payload = payload(mapper, section, body, contentHash, version);
        if (existing.isPresent() && withoutVersion(existing.get()).equals(withoutVersion(payload))) {
            return AdapterEvaluation.match(currentText.get(), "payload up to date at version " + version);
        }

        String proposed = serialize(payload);
        long maxBytes = section.maxBytes().orElse(DEFAULT_MAX_BYTES);
        int size = proposed.getBytes(StandardCharsets.UTF_8).length;
        RegionStatus status = currentText.isPresent() ? RegionStatus.DRIFT : RegionStatus.MISSING_FILE;
        if (size > maxBytes) {
            return new AdapterEvaluation(status, Optional.empty(),
                    "payload of " + size + " bytes exceeds max_bytes " + maxBytes,
                    Optional.of(IssueCode.SIZE_BUDGET_EXCEEDED));
        }
        String detail = currentText.isPresent()
                ? "payload update to version " + version
                : "payload not generated yet";
        return new AdapterEvaluation(status, Optional.of(proposed), detail, Optional.empty());
    }

    @Override
    public boolean supportsAdopt() {
        return true;
    }

    @Override
    public String adoptedContent(SectionConfig section, Path target, String currentText) {
        try {
            JsonNode value = JacksonUtility.getJsonMapper().readTree(currentText).path("body").path(REPRESENTATION).path("value");
            if (!value.isTextual()) {
                throw new DocsBridgeException(IssueCode.CORRUPTED_TARGET, section.name(), target.toString(),
                        "Confluence payload " + target + " has no body.storage.value");
            }
            return value.asText();
        } catch (JsonProcessingException ex) {
            throw new DocsBridgeException(IssueCode.CORRUPTED_TARGET, section.name(), target.toString(),
                    "Confluence payload " + target + " is not valid JSON", ex);
        }
    }

    static String slug(SectionConfig section) {
        String explicit = section.option("slug", null);
        if (explicit != null) {
            return explicit.trim();
        }
        return section.option("title", section.name()).trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]+", "-");
    }

    private ObjectNode payload(ObjectMapper mapper, SectionConfig section, String body, String contentHash, int version) {
        ObjectNode payload = mapper.createObjectNode();
        putOptional(payload, "space", section.option("space", null));
        putOptional(payload, "ancestorId", section.option("ancestor_id", null));
        payload.put("title", section.option("title", section.name()));
        payload.put("slug", slug(section));
        ObjectNode versionNode = payload.putObject("version");
        versionNode.put("number", version);
        versionNode.put("contentHash", contentHash);
        ObjectNode storage = payload.putObject("body").putObject(REPRESENTATION);
        storage.put("value", body);
        storage.put("representation", REPRESENTATION);
        return payload;
    }

    // The version block is bookkeeping; an adopted body keeps the version it was adopted at.
    private JsonNode withoutVersion(JsonNode payload) {
        ObjectNode copy = ((ObjectNode) payload).deepCopy();
        copy.remove("version");
        return copy;
    }

    private void putOptional(ObjectNode node, String field, String value) {
        if (value == null) {
            node.putNull(field);
        } else {
            node.put(field, value);
        }
    }

    private String serialize(ObjectNode payload) {
        try {
            return JacksonUtility.getPrettyJsonWriter().writeValueAsString(payload) + "\n";
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize Confluence payload", ex);
        }
    }
}
