package ai.docsite.bridge.registry;

import ai.docsite.bridge.issue.DocsBridgeException;
import ai.docsite.bridge.issue.IssueCode;
import ai.docsite.bridge.marker.MarkerSyntax;
import ai.docsite.bridge.util.JacksonUtility;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads {@code docs.bridge.yaml} into a {@link SectionRegistry}, validating every section before any
 * file is touched.
 */
public class SectionRegistryLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(SectionRegistryLoader.class);

    public static final Path DEFAULT_CONFIG = Path.of(".agentcontrol", "config", "docs.bridge.yaml");
    public static final Path LEGACY_CONFIG = Path.of("agentcontrol", "config", "docs.bridge.yaml");

    static final int SUPPORTED_VERSION = 1;
    static final String DEFAULT_ROOT = "docs";

    /**
     * Loads the registry for {@code projectRoot}. An explicit {@code configFile} must exist; without
     * one the default and legacy locations are tried, and the built-in registry is used when
     * neither exists.
     */
    public SectionRegistry load(Path projectRoot, Optional<Path> configFile) {
        Path root = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        if (configFile.isPresent()) {
            Path explicit = root.resolve(configFile.get()).normalize();
            if (!Files.isRegularFile(explicit)) {
                throw DocsBridgeException.invalidConfig(explicit.toString(), "Configuration file not found: " + explicit);
            }
            return parse(root, explicit);
        }
        for (Path candidate : List.of(DEFAULT_CONFIG, LEGACY_CONFIG)) {
            Path path = root.resolve(candidate);
            if (Files.isRegularFile(path)) {
                if (candidate == LEGACY_CONFIG) {
                    LOGGER.warn("Using legacy docs bridge configuration {}; move it to {}", path, DEFAULT_CONFIG);
                }
                return parse(root, path);
            }
        }
        LOGGER.debug("No docs bridge configuration under {}, using built-in sections", root);
        return defaults(root);
    }

    /**
     * Built-in registry: architecture overview, ADR index and RFC index under {@code docs/}.
     */
    public SectionRegistry defaults(Path projectRoot) {
        Path root = projectRoot.toAbsolutePath().normalize();
        List<SectionConfig> sections = List.of(
                SectionConfig.managed("architecture_overview", "architecture/overview.md",
                        "agentcontrol-architecture-overview", null),
                SectionConfig.managed("adr_index", "adr/index.md", "agentcontrol-adr-index", null),
                SectionConfig.managed("rfc_index", "rfc/index.md", "agentcontrol-rfc-index", null));
        return new SectionRegistry(Optional.empty(), root, root.resolve(DEFAULT_ROOT).normalize(), sections);
    }

    SectionRegistry parse(Path projectRoot, Path configPath) {
        String source = configPath.toString();
        JsonNode document;
        try {
            document = JacksonUtility.getYamlMapper().readTree(Files.readString(configPath, StandardCharsets.UTF_8));
        } catch (JsonProcessingException ex) {
            throw new DocsBridgeException(IssueCode.INVALID_CONFIG, null, source,
                    "Malformed YAML in " + source + ": " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new DocsBridgeException(IssueCode.IO_FAILURE, null, source,
                    "Failed to read " + source, ex);
        }
        if (document == null || document.isMissingNode() || document.isNull()) {
            document = JacksonUtility.getYamlMapper().createObjectNode();
        }
        if (!document.isObject()) {
            throw DocsBridgeException.invalidConfig(source, "Configuration in " + source + " must be a mapping");
        }

        JsonNode versionNode = document.path("version");
        int version = versionNode.isMissingNode() ? SUPPORTED_VERSION : versionNode.asInt(-1);
        if (version != SUPPORTED_VERSION) {
            throw DocsBridgeException.invalidConfig(source,
                    "Unsupported docs bridge config version " + versionNode.asText() + " in " + source);
        }

        JsonNode rootNode = document.path("root");
        if (!rootNode.isMissingNode() && !rootNode.isTextual()) {
            throw DocsBridgeException.invalidConfig(source, "docs bridge root must be a string");
        }
        String rootValue = rootNode.isTextual() && !rootNode.asText().isBlank() ? rootNode.asText().trim() : DEFAULT_ROOT;
        Path docsRoot = projectRoot.resolve(rootValue).normalize();

        JsonNode sectionsNode = document.path("sections");
        if (!sectionsNode.isMissingNode() && !sectionsNode.isNull() && !sectionsNode.isObject()) {
            throw DocsBridgeException.invalidConfig(source, "'sections' must be a mapping of section definitions");
        }

        List<SectionConfig> sections = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = sectionsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            sections.add(parseSection(source, field.getKey(), field.getValue()));
        }

        SectionRegistry registry = new SectionRegistry(Optional.of(configPath), projectRoot, docsRoot, sections);
        validateTargets(source, registry);
        LOGGER.debug("Loaded {} docs bridge sections from {}", sections.size(), source);
        return registry;
    }

    private SectionConfig parseSection(String source, String name, JsonNode definition) {
        if (name == null || name.isBlank()) {
            throw DocsBridgeException.invalidConfig(source, "Section names must not be blank");
        }
        if (!SectionConfig.isValidName(name)) {
            throw DocsBridgeException.invalidConfig(source,
                    "Section name '" + name + "' must match [A-Za-z0-9._-]+ and must not be . or ..");
        }
        if (!definition.isObject()) {
            throw DocsBridgeException.invalidConfig(source, "Section '" + name + "' in " + source + " must be a mapping");
        }
        SectionMode mode;
        AdapterKind adapter = null;
        try {
            mode = SectionMode.from(text(source, name, definition, "mode"));
            String adapterValue = text(source, name, definition, "adapter");
            if (adapterValue != null) {
                adapter = AdapterKind.from(adapterValue);
            }
        } catch (IllegalArgumentException ex) {
            throw DocsBridgeException.invalidConfig(source, "Section '" + name + "': " + ex.getMessage());
        }

        String target = text(source, name, definition, "target");
        String marker = text(source, name, definition, "marker");
        if (marker != null && !MarkerSyntax.isValidToken(marker.trim())) {
            throw DocsBridgeException.invalidConfig(source,
                    "Section '" + name + "' marker '" + marker + "' must match [A-Za-z0-9._-]+");
        }
        if (marker == null && !MarkerSyntax.isValidToken(SectionConfig.defaultMarker(name))) {
            throw DocsBridgeException.invalidConfig(source,
                    "Section '" + name + "' needs an explicit marker: its name is not a valid marker token");
        }
        AnchorPolicy anchor = parseAnchor(source, name, definition);
        Map<String, String> options = parseOptions(source, name, definition.path("options"));

        try {
            if (mode == SectionMode.EXTERNAL) {
                if (adapter == null) {
                    throw DocsBridgeException.invalidConfig(source,
                            "Section '" + name + "' requires 'adapter' when mode is external");
                }
                return new SectionConfig(name, target, marker, mode, anchor, Optional.of(adapter), options);
            }
            if (adapter != null) {
                throw DocsBridgeException.invalidConfig(source,
                        "Section '" + name + "' declares an adapter but its mode is managed");
            }
            if (target == null || target.isBlank()) {
                throw DocsBridgeException.invalidConfig(source, "Section '" + name + "' must define 'target'");
            }
            return new SectionConfig(name, target, marker, mode, anchor, Optional.empty(), options);
        } catch (IllegalArgumentException ex) {
            throw DocsBridgeException.invalidConfig(source, "Section '" + name + "': " + ex.getMessage());
        }
    }

    private AnchorPolicy parseAnchor(String source, String name, JsonNode definition) {
        String afterHeading = text(source, name, definition, "insert_after_heading");
        String beforeMarker = text(source, name, definition, "insert_before_marker");
        if (afterHeading != null && beforeMarker != null) {
            throw DocsBridgeException.invalidConfig(source,
                    "Section '" + name + "' cannot set both insert_after_heading and insert_before_marker");
        }
        if (afterHeading != null) {
            if (afterHeading.isBlank()) {
                throw DocsBridgeException.invalidConfig(source,
                        "Section '" + name + "' insert_after_heading must be a non-empty string");
            }
            return new AnchorPolicy.AfterHeading(afterHeading);
        }
        if (beforeMarker != null) {
            if (!MarkerSyntax.isValidToken(beforeMarker.trim())) {
                throw DocsBridgeException.invalidConfig(source,
                        "Section '" + name + "' insert_before_marker must be a valid marker token");
            }
            return new AnchorPolicy.BeforeMarker(beforeMarker);
        }
        return AnchorPolicy.APPEND_END;
    }

    private Map<String, String> parseOptions(String source, String name, JsonNode optionsNode) {
        if (optionsNode.isMissingNode() || optionsNode.isNull()) {
            return Map.of();
        }
        if (!optionsNode.isObject()) {
            throw DocsBridgeException.invalidConfig(source, "Section '" + name + "' options must be a mapping");
        }
        Map<String, String> options = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = optionsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isValueNode() || field.getValue().isNull()) {
                throw DocsBridgeException.invalidConfig(source,
                        "Section '" + name + "' option '" + field.getKey() + "' must be a scalar value");
            }
            options.put(field.getKey(), field.getValue().asText());
        }
        return options;
    }

    private String text(String source, String name, JsonNode definition, String key) {
        JsonNode node = definition.path(key);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (!node.isValueNode() || node.isBoolean()) {
            throw DocsBridgeException.invalidConfig(source, "Section '" + name + "' " + key + " must be a string");
        }
        return node.asText();
    }

    private void validateTargets(String source, SectionRegistry registry) {
        Map<Path, Map<String, String>> markersByTarget = new HashMap<>();
        for (SectionConfig section : registry.sections()) {
            Optional<Path> target = registry.targetPath(section);
            if (target.isEmpty()) {
                continue;
            }
            if (!target.get().startsWith(registry.projectRoot())) {
                throw DocsBridgeException.invalidConfig(source,
                        "Section '" + section.name() + "' target " + target.get() + " escapes the project root");
            }
            if (section.isExternal()) {
                continue;
            }
            Map<String, String> markers = markersByTarget.computeIfAbsent(target.get(), key -> new HashMap<>());
            String previous = markers.putIfAbsent(section.marker(), section.name());
            if (previous != null) {
                throw DocsBridgeException.invalidConfig(source, "Sections '" + previous + "' and '" + section.name()
                        + "' share marker '" + section.marker() + "' in " + target.get());
            }
        }
    }
}
