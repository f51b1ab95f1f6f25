package ai.docsite.bridge.anchor;

import ai.docsite.bridge.issue.DocsBridgeException;
import ai.docsite.bridge.issue.IssueCode;
import ai.docsite.bridge.marker.DocumentLines;
import ai.docsite.bridge.marker.MarkerSyntax;
import ai.docsite.bridge.registry.AnchorPolicy;
import ai.docsite.bridge.registry.SectionConfig;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Computes where a region that has never been materialized goes. Pure: the same policy and
 * document always give the same insertion point.
 */
public class AnchorResolver {

    public InsertionPoint resolve(SectionConfig section, Path target, DocumentLines document) {
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(document, "document");
        AnchorPolicy anchor = section.anchor();
        if (anchor instanceof AnchorPolicy.AfterHeading afterHeading) {
            return afterHeading(section, target, document, afterHeading.heading());
        }
        if (anchor instanceof AnchorPolicy.BeforeMarker beforeMarker) {
            return beforeMarker(section, target, document, beforeMarker.token());
        }
        return appendEnd(document);
    }

    /**
     * Lines to splice in at {@code point}: optional blank line, the wrapped region, optional blank line.
     */
    public List<String> regionLines(InsertionPoint point, String marker, String content) {
        List<String> lines = new ArrayList<>();
        if (point.blankBefore()) {
            lines.add("");
        }
        lines.addAll(MarkerSyntax.wrap(marker, content));
        if (point.blankAfter()) {
            lines.add("");
        }
        return lines;
    }

    private InsertionPoint afterHeading(SectionConfig section, Path target, DocumentLines document, String heading) {
        for (int i = 0; i < document.size(); i++) {
            if (!document.line(i).trim().equals(heading)) {
                continue;
            }
            int insertAt = i + 1;
            boolean blankBefore = true;
            if (insertAt < document.size() && document.isBlank(insertAt)) {
                insertAt++;
                blankBefore = false;
            }
            boolean blankAfter = insertAt < document.size() && !document.isBlank(insertAt);
            return new InsertionPoint(insertAt, blankBefore, blankAfter);
        }
        throw notFound(section, target, "heading '" + heading + "'");
    }

    private InsertionPoint beforeMarker(SectionConfig section, Path target, DocumentLines document, String token) {
        for (int i = 0; i < document.size(); i++) {
            if (MarkerSyntax.isStart(document.line(i), token)) {
                return new InsertionPoint(i, false, false);
            }
        }
        throw notFound(section, target, "start marker of '" + token + "'");
    }

    private InsertionPoint appendEnd(DocumentLines document) {
        boolean blankBefore = !document.isEmpty() && !document.endsWithBlankLine();
        return new InsertionPoint(document.size(), blankBefore, false);
    }

    private DocsBridgeException notFound(SectionConfig section, Path target, String anchor) {
        String path = target == null ? null : target.toString();
        return new DocsBridgeException(IssueCode.ANCHOR_NOT_FOUND, section.name(), path,
                "Anchor " + anchor + " not found in " + path);
    }
}
