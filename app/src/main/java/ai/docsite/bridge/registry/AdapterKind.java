package ai.docsite.bridge.registry;

/**
 * Target integrations available to external sections.
 */
public enum AdapterKind {
    MKDOCS_NAV("mkdocs_nav"),
    DOCUSAURUS_SIDEBAR("docusaurus_sidebar"),
    CONFLUENCE_PAGE("confluence_page");

    private final String label;

    AdapterKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static AdapterKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Adapter must be provided");
        }
        return switch (raw.trim().toLowerCase()) {
            case "mkdocs_nav", "mkdocs" -> MKDOCS_NAV;
            case "docusaurus_sidebar", "docusaurus" -> DOCUSAURUS_SIDEBAR;
            case "confluence_page", "confluence" -> CONFLUENCE_PAGE;
            default -> throw new IllegalArgumentException("Unsupported external adapter: " + raw);
        };
    }
}
