package ai.docsite.bridge.content;

import java.util.Optional;

/**
 * Collaborator that renders the content a section should hold.
 */
@FunctionalInterface
public interface DesiredContentProvider {

    Optional<DesiredContent> render(String sectionName);
}
