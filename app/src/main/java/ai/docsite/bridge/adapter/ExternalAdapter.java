package ai.docsite.bridge.adapter;

import ai.docsite.bridge.content.DesiredContent;
import ai.docsite.bridge.issue.DocsBridgeException;
import ai.docsite.bridge.issue.IssueCode;
import ai.docsite.bridge.registry.AdapterKind;
import ai.docsite.bridge.registry.SectionConfig;
import ai.docsite.bridge.registry.SectionRegistry;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Maintains an external section inside a documentation tool's own file format. Implementations are
 * pure transforms: reading and writing the target belongs to the caller.
 */
public interface ExternalAdapter {

    AdapterKind kind();

    /**
     * File name under the project root used when the section declares no target.
     */
    String defaultTarget();

    /**
     * Whether {@link #evaluate} needs rendered content for the section.
     */
    default boolean requiresContent() {
        return false;
    }

    default Path resolveTarget(SectionConfig section, SectionRegistry registry, Path stateDirectory) {
        return registry.targetPath(section).orElseGet(() -> registry.projectRoot().resolve(defaultTarget()).normalize());
    }

    /**
     * @param currentText target content, empty when the file does not exist
     */
    AdapterEvaluation evaluate(SectionConfig section, DesiredContent desired, Optional<String> currentText);

    default boolean supportsAdopt() {
        return false;
    }

    /**
     * Content to record as the adopted baseline, taken from the current target.
     */
    default String adoptedContent(SectionConfig section, Path target, String currentText) {
        throw new DocsBridgeException(IssueCode.UNSUPPORTED_OPERATION, section.name(), target.toString(),
                "Adapter " + kind().label() + " does not support adopt");
    }
}
