package ai.docsite.bridge.cli;

import ai.docsite.bridge.backup.BackupSnapshot;
import ai.docsite.bridge.issue.Issue;
import ai.docsite.bridge.lifecycle.RunReport;
import ai.docsite.bridge.lifecycle.SectionReport;
import ai.docsite.bridge.util.JacksonUtility;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.PrintWriter;
import java.util.Map;

/**
 * Renders run reports on stdout, either as the JSON document automation consumes or as a short
 * human summary.
 */
class ReportPrinter {

    private final PrintWriter out;

    ReportPrinter(PrintWriter out) {
        this.out = out;
    }

    void print(RunReport report, boolean json) {
        if (json) {
            out.println(toJson(report));
        } else {
            printText(report);
        }
        out.flush();
    }

    String toJson(RunReport report) {
        ObjectNode root = JacksonUtility.getJsonMapper().createObjectNode();
        root.put("command", report.command());
        root.put("generatedAt", report.generatedAt().toString());
        root.put("status", report.status().label());
        ArrayNode sections = root.putArray("sections");
        for (SectionReport section : report.sections()) {
            sections.add(toJson(section));
        }
        ArrayNode issues = root.putArray("issues");
        for (Issue issue : report.issues()) {
            ObjectNode node = issues.addObject();
            node.put("code", issue.code().code());
            putIfPresent(node, "section", issue.section());
            putIfPresent(node, "path", issue.path());
            node.put("message", issue.message());
            node.put("severity", issue.severity().label());
            node.put("remediation", issue.remediation());
        }
        try {
            return JacksonUtility.getPrettyJsonWriter().writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize report", ex);
        }
    }

    private ObjectNode toJson(SectionReport section) {
        ObjectNode node = JacksonUtility.getJsonMapper().createObjectNode();
        node.put("name", section.name());
        putIfPresent(node, "status", section.status());
        putIfPresent(node, "mode", section.mode());
        putIfPresent(node, "target", section.target());
        putIfPresent(node, "marker", section.marker());
        if (section.anchor() != null) {
            ObjectNode anchor = node.putObject("anchor");
            section.anchor().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(entry -> anchor.put(entry.getKey(), entry.getValue()));
        }
        putIfPresent(node, "adapter", section.adapter());
        putIfPresent(node, "action", section.action());
        putIfPresent(node, "backup", section.backup());
        putIfPresent(node, "contentHash", section.contentHash());
        putIfPresent(node, "expectedHash", section.expectedHash());
        putIfPresent(node, "diff", section.diff());
        putIfPresent(node, "detail", section.detail());
        if (section.snapshots() != null) {
            ArrayNode snapshots = node.putArray("snapshots");
            for (BackupSnapshot snapshot : section.snapshots()) {
                snapshots.addObject()
                        .put("id", snapshot.id())
                        .put("timestamp", snapshot.timestamp().toString())
                        .put("existed", snapshot.existed());
            }
        }
        return node;
    }

    private void printText(RunReport report) {
        out.printf("docs %s @ %s: status=%s%n", report.command(), report.generatedAt(), report.status().label());
        for (SectionReport section : report.sections()) {
            out.printf("  - %s: status=%s target=%s%n", section.name(), section.status(), section.target());
            if (section.marker() != null) {
                out.printf("      marker=%s%n", section.marker());
            }
            if (section.adapter() != null) {
                out.printf("      adapter=%s%n", section.adapter());
            }
            if (section.action() != null) {
                out.printf("      action=%s%s%n", section.action(),
                        section.backup() == null ? "" : " backup=" + section.backup());
            }
            if (section.diff() != null) {
                section.diff().lines().forEach(line -> out.printf("      %s%n", line));
            }
            if (section.snapshots() != null) {
                if (section.snapshots().isEmpty()) {
                    out.println("      no backups recorded");
                }
                for (BackupSnapshot snapshot : section.snapshots()) {
                    out.printf("      %s (%s)%s%n", snapshot.id(), snapshot.timestamp(),
                            snapshot.existed() ? "" : " file absent");
                }
            }
        }
        if (!report.issues().isEmpty()) {
            out.println("issues:");
            for (Issue issue : report.issues()) {
                out.printf("  - %s: %s%n", issue.code().code(), issue.message());
                out.printf("    remediation: %s%n", issue.remediation());
            }
        }
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
