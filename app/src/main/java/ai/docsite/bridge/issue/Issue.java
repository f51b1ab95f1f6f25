package ai.docsite.bridge.issue;

import java.util.Objects;

/**
 * A diagnosed problem reported to the caller. Carries everything an automated agent needs to
 * branch on the failure without parsing prose.
 */
public record Issue(IssueCode code, Severity severity, String section, String path, String message, String remediation) {

    public Issue {
        Objects.requireNonNull(code, "code");
        severity = severity == null ? code.severity() : severity;
        message = message == null ? code.code() : message;
        remediation = remediation == null ? code.remediation(section, path) : remediation;
    }

    public static Issue of(IssueCode code, String section, String path, String message) {
        return new Issue(code, code.severity(), section, path, message, null);
    }

    public static Issue from(DocsBridgeException exception, String section) {
        String owner = exception.section() != null ? exception.section() : section;
        return new Issue(exception.code(), exception.code().severity(), owner, exception.path(),
                exception.getMessage(), exception.remediation());
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
