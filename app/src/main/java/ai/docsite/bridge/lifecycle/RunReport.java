package ai.docsite.bridge.lifecycle;

import ai.docsite.bridge.issue.Issue;
import ai.docsite.bridge.issue.Severity;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one lifecycle command across all selected sections.
 */
public record RunReport(String command, Instant generatedAt, List<SectionReport> sections, List<Issue> issues) {

    public RunReport {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(generatedAt, "generatedAt");
        sections = List.copyOf(sections);
        issues = List.copyOf(issues);
    }

    public RunStatus status() {
        Severity worst = Severity.INFO;
        for (Issue issue : issues) {
            worst = worst.max(issue.severity());
        }
        return switch (worst) {
            case ERROR -> RunStatus.ERROR;
            case WARNING -> RunStatus.WARNING;
            case INFO -> RunStatus.OK;
        };
    }

    public Optional<SectionReport> section(String name) {
        return sections.stream().filter(section -> section.name().equals(name)).findFirst();
    }
}
