package ai.docsite.bridge.issue;

/**
 * Machine-readable error taxonomy of the docs bridge. Each code carries a default severity and a
 * remediation template; {@code {section}} and {@code {path}} placeholders are filled per issue.
 */
public enum IssueCode {
    INVALID_CONFIG("DOC_BRIDGE_INVALID_CONFIG", Severity.ERROR,
            "Fix {path} so that every section declares a valid mode, target and marker, then rerun `docs-bridge diagnose`.",
            "the docs bridge configuration"),
    MISSING_FILE("DOC_BRIDGE_MISSING_FILE", Severity.ERROR,
            "Create or restore {path} (or adjust the target of section '{section}') before running repair."),
    MISSING_MARKER("DOC_BRIDGE_MISSING_MARKER", Severity.WARNING,
            "Run `docs-bridge repair --section {section}` to insert the managed region into {path}."),
    DUPLICATE_MARKER("DOC_BRIDGE_DUPLICATE_MARKER", Severity.ERROR,
            "Manually remove the duplicate managed markers of section '{section}' in {path}; repair will not guess which pair is authoritative."),
    CORRUPTED_MARKERS("DOC_BRIDGE_CORRUPTED_MARKERS", Severity.ERROR,
            "Manually restore a single start/end marker pair for section '{section}' in {path}, then rerun `docs-bridge diff --section {section}`."),
    ANCHOR_NOT_FOUND("DOC_BRIDGE_ANCHOR_NOT_FOUND", Severity.ERROR,
            "Add the anchor referenced by section '{section}' to {path} or change its insert_after_heading/insert_before_marker setting."),
    CONFLICT("DOC_BRIDGE_CONFLICT", Severity.ERROR,
            "{path} changed after it was diagnosed; rerun `docs-bridge diff --section {section}` and repair again."),
    SIZE_BUDGET_EXCEEDED("DOC_BRIDGE_SIZE_BUDGET_EXCEEDED", Severity.ERROR,
            "Reduce the generated content of section '{section}' or raise its max_bytes option."),
    DRIFT("DOC_BRIDGE_DRIFT", Severity.WARNING,
            "Run `docs-bridge repair --section {section}` to restore generated content, or `docs-bridge adopt --section {section}` to keep the edits in {path}."),
    MISSING_CONTENT("DOC_BRIDGE_MISSING_CONTENT", Severity.ERROR,
            "Regenerate the documentation content for section '{section}' before running repair."),
    CORRUPTED_TARGET("DOC_BRIDGE_CORRUPTED_TARGET", Severity.ERROR,
            "Fix the syntax of {path} so that section '{section}' can be merged into it."),
    UNSUPPORTED_OPERATION("DOC_BRIDGE_UNSUPPORTED_OPERATION", Severity.ERROR,
            "Section '{section}' does not support this operation; use repair instead."),
    BACKUP_NOT_FOUND("DOC_BRIDGE_BACKUP_NOT_FOUND", Severity.ERROR,
            "Run `docs-bridge history --section {section}` to list available backup timestamps."),
    UNKNOWN_SECTION("DOC_BRIDGE_UNKNOWN_SECTION", Severity.ERROR,
            "Run `docs-bridge list` to see the configured section names."),
    IO_FAILURE("DOC_BRIDGE_IO_FAILURE", Severity.ERROR,
            "Check file permissions and free space for {path}, then retry."),
    INTERNAL_ERROR("DOC_BRIDGE_INTERNAL_ERROR", Severity.ERROR,
            "Rerun with --log-format json and report the logged stack trace.");

    private final String code;
    private final Severity severity;
    private final String remediationTemplate;
    private final String defaultPath;

    IssueCode(String code, Severity severity, String remediationTemplate) {
        this(code, severity, remediationTemplate, "the target file");
    }

    IssueCode(String code, Severity severity, String remediationTemplate, String defaultPath) {
        this.code = code;
        this.severity = severity;
        this.remediationTemplate = remediationTemplate;
        this.defaultPath = defaultPath;
    }

    public String code() {
        return code;
    }

    public Severity severity() {
        return severity;
    }

    public String remediation(String section, String path) {
        return remediationTemplate
                .replace("{section}", section == null ? "<section>" : section)
                .replace("{path}", path == null ? defaultPath : path);
    }
}
