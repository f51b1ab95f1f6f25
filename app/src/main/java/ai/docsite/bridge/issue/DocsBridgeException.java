package ai.docsite.bridge.issue;

import java.util.Objects;

/**
 * Runtime exception carrying a docs bridge issue code. Thrown at the point of failure and turned
 * into an {@link Issue} by the lifecycle orchestrator.
 */
public class DocsBridgeException extends RuntimeException {

    private final IssueCode code;
    private final String section;
    private final String path;

    public DocsBridgeException(IssueCode code, String section, String path, String message) {
        this(code, section, path, message, null);
    }

    public DocsBridgeException(IssueCode code, String section, String path, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
        this.section = section;
        this.path = path;
    }

    public static DocsBridgeException invalidConfig(String path, String message) {
        return new DocsBridgeException(IssueCode.INVALID_CONFIG, null, path, message);
    }

    public IssueCode code() {
        return code;
    }

    public String section() {
        return section;
    }

    public String path() {
        return path;
    }

    public String remediation() {
        return code.remediation(section, path);
    }
}
