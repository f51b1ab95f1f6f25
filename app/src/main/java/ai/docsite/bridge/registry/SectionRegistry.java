package ai.docsite.bridge.registry;

import ai.docsite.bridge.issue.DocsBridgeException;
import ai.docsite.bridge.issue.IssueCode;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Validated, ordered set of sections for one project. Reloaded on every invocation.
 *
 * @param source configuration file the registry was loaded from, empty for the built-in default
 * @param projectRoot absolute project root
 * @param docsRoot absolute documentation root that managed targets resolve against
 * @param sections sections in configuration order
 */
public record SectionRegistry(Optional<Path> source, Path projectRoot, Path docsRoot, List<SectionConfig> sections) {

    public SectionRegistry {
        source = source == null ? Optional.empty() : source;
        Objects.requireNonNull(projectRoot, "projectRoot");
        Objects.requireNonNull(docsRoot, "docsRoot");
        sections = List.copyOf(sections);
    }

    public Optional<SectionConfig> find(String name) {
        return sections.stream().filter(section -> section.name().equals(name)).findFirst();
    }

    public SectionConfig require(String name) {
        return find(name).orElseThrow(() -> new DocsBridgeException(IssueCode.UNKNOWN_SECTION, name,
                source.map(Path::toString).orElse(null), "Unknown section '" + name + "'"));
    }

    /**
     * Absolute host file of a section; empty for external sections that rely on an adapter default.
     */
    public Optional<Path> targetPath(SectionConfig section) {
        return section.declaredTarget().map(target -> resolve(section, target));
    }

    public Path relativize(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        return absolute.startsWith(projectRoot) ? projectRoot.relativize(absolute) : absolute;
    }

    private Path resolve(SectionConfig section, String target) {
        Path base = section.isExternal() ? projectRoot : docsRoot;
        return base.resolve(target).toAbsolutePath().normalize();
    }
}
