package ai.docsite.bridge.lifecycle;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.bridge.content.DesiredContent;
import ai.docsite.bridge.diff.DiffEngine;
import ai.docsite.bridge.diff.RegionDiagnosis;
import ai.docsite.bridge.diff.RegionStatus;
import ai.docsite.bridge.issue.Issue;
import ai.docsite.bridge.issue.IssueCode;
import ai.docsite.bridge.registry.AdapterKind;
import ai.docsite.bridge.registry.AnchorPolicy;
import ai.docsite.bridge.registry.SectionConfig;
import ai.docsite.bridge.registry.SectionRegistry;
import ai.docsite.bridge.writer.AtomicFileWriter;
import ai.docsite.bridge.writer.WriteOutcome;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocsLifecycleServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);
    private static final String START = "<!-- agentcontrol:start:notes -->";
    private static final String END = "<!-- agentcontrol:end:notes -->";

    @TempDir
    Path tempDir;

    private Path root;
    private Path stateDir;
    private final Map<String, String> rendered = new HashMap<>();

    @BeforeEach
    void setUp() {
        root = tempDir.toAbsolutePath().normalize();
        stateDir = root.resolve(".agentcontrol/state/docs");
        rendered.put("notes", "v2");
    }

    @Test
    void repairFailsWhenAnchorIsAbsentInEmptyFile() throws Exception {
        Path target = write("notes.md", "");

        RunReport report = service(notesSection("notes.md")).repair(Optional.empty());

        assertThat(report.status()).isEqualTo(RunStatus.ERROR);
        assertThat(report.issues()).extracting(Issue::code).containsExactly(IssueCode.ANCHOR_NOT_FOUND);
        assertThat(report.section("notes").orElseThrow().action()).isEqualTo(SectionReport.SKIPPED);
        assertThat(Files.readString(target)).isEmpty();
    }

    @Test
    void repairInsertsRegionAfterHeadingAndDiffMatches() throws Exception {
        Path target = write("notes.md", "# Notes\n\nbody");
        DocsLifecycleService service = service(notesSection("notes.md"));

        RunReport repair = service.repair(Optional.of("notes"));

        assertThat(repair.section("notes").orElseThrow().status()).isEqualTo("missing_marker");
        assertThat(repair.section("notes").orElseThrow().action()).isEqualTo(WriteOutcome.INSERTED);
        assertThat(Files.readString(target)).isEqualTo("# Notes\n\n" + START + "\nv2\n" + END + "\n\nbody");
        RunReport diff = service.diff("notes");
        assertThat(diff.section("notes").orElseThrow().status()).isEqualTo("match");
        assertThat(diff.status()).isEqualTo(RunStatus.OK);
    }

    @Test
    void repairOverwritesDriftAndSecondRepairIsNoop() throws Exception {
        Path target = write("notes.md", "# Notes\n" + START + "\nv1\n" + END + "\n");
        DocsLifecycleService service = service(notesSection("notes.md"));

        RunReport diagnose = service.diagnose();
        assertThat(diagnose.section("notes").orElseThrow().status()).isEqualTo("drift");
        assertThat(diagnose.status()).isEqualTo(RunStatus.WARNING);
        assertThat(diagnose.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo(IssueCode.DRIFT);
            assertThat(issue.path()).isEqualTo("notes.md");
            assertThat(issue.message()).contains("(+1 -1 lines)");
        });

        RunReport first = service.repair(Optional.empty());
        assertThat(first.section("notes").orElseThrow().action()).isEqualTo(WriteOutcome.UPDATED);
        assertThat(Files.readString(target)).isEqualTo("# Notes\n" + START + "\nv2\n" + END + "\n");

        RunReport second = service.repair(Optional.empty());
        SectionReport noop = second.section("notes").orElseThrow();
        assertThat(noop.status()).isEqualTo("match");
        assertThat(noop.action()).isEqualTo(WriteOutcome.NOOP);
        assertThat(noop.backup()).isNull();
        assertThat(service.history("notes").section("notes").orElseThrow().snapshots()).hasSize(1);
    }

    @Test
    void sectionsSharingMarkerAcrossFilesStayIndependent() throws Exception {
        Path first = write("a.md", START + "\nv1\n" + END + "\n");
        Path second = write("b.md", "intro\n" + START + "\nv2\n" + END + "\n");
        rendered.put("first", "v2");
        rendered.put("second", "v2");
        DocsLifecycleService service = service(
                SectionConfig.managed("first", "a.md", "notes", null),
                SectionConfig.managed("second", "b.md", "notes", null));

        RunReport report = service.repair(Optional.empty());

        assertThat(report.section("first").orElseThrow().action()).isEqualTo(WriteOutcome.UPDATED);
        assertThat(report.section("second").orElseThrow().action()).isEqualTo(WriteOutcome.NOOP);
        assertThat(Files.readString(first)).isEqualTo(START + "\nv2\n" + END + "\n");
        assertThat(Files.readString(second)).isEqualTo("intro\n" + START + "\nv2\n" + END + "\n");
    }

    @Test
    void interruptedWriteLeavesFileUntouchedButKeepsBackup() throws Exception {
        String original = "# Notes\n" + START + "\nv1\n" + END + "\n";
        Path target = write("notes.md", original);
        AtomicFileWriter crashing = new AtomicFileWriter((temporary, destination) -> {
            if (destination.equals(target)) {
                throw new IOException("simulated crash before rename");
            }
        });
        SectionRegistry registry = registry(notesSection("notes.md"));

        RunReport crashed = new DocsLifecycleService(registry, stateDir, this::render, crashing, CLOCK, 20)
                .repair(Optional.empty());

        assertThat(crashed.issues()).extracting(Issue::code).containsExactly(IssueCode.IO_FAILURE);
        assertThat(crashed.section("notes").orElseThrow().status()).isEqualTo(SectionReport.ERROR);
        assertThat(Files.readString(target)).isEqualTo(original);
        DocsLifecycleService service = service(notesSection("notes.md"));
        assertThat(service.diagnose().section("notes").orElseThrow().status()).isEqualTo("drift");
        assertThat(service.history("notes").section("notes").orElseThrow().snapshots())
                .singleElement().satisfies(snapshot -> assertThat(snapshot.priorContent()).contains(original));
        try (var files = Files.list(root)) {
            assertThat(files.map(path -> path.getFileName().toString()))
                    .noneMatch(name -> name.endsWith(".tmp"));
        }
    }

    @Test
    void diagnosisNeverTouchesFiles() throws Exception {
        Path drifting = write("notes.md", "# Notes\n" + START + "\nv1\n" + END + "\n");
        Path corrupted = write("broken.md", START + "\n" + START + "\n");
        rendered.put("broken", "x");
        FileTime past = FileTime.from(Instant.parse("2020-01-01T00:00:00Z"));
        Files.setLastModifiedTime(drifting, past);
        Files.setLastModifiedTime(corrupted, past);
        DocsLifecycleService service = service(notesSection("notes.md"),
                SectionConfig.managed("broken", "broken.md", "notes", null));

        service.diagnose();
        service.list();
        service.diff("notes");
        service.diff("broken");

        assertThat(Files.getLastModifiedTime(drifting)).isEqualTo(past);
        assertThat(Files.getLastModifiedTime(corrupted)).isEqualTo(past);
        assertThat(Files.readString(corrupted)).isEqualTo(START + "\n" + START + "\n");
        assertThat(Files.exists(stateDir)).isFalse();
    }

    @Test
    void diffRendersUnifiedLines() throws Exception {
        write("notes.md", "# Notes\n" + START + "\nkeep\nv1\n" + END + "\n");
        rendered.put("notes", "keep\nv2");

        SectionReport section = service(notesSection("notes.md")).diff("notes").section("notes").orElseThrow();

        assertThat(section.diff()).isEqualTo("--- current\n+++ desired\n keep\n-v1\n+v2");
        assertThat(section.marker()).isEqualTo("notes");
        assertThat(section.anchor()).containsEntry("type", "insert_after_heading");
    }

    @Test
    void corruptedSectionDoesNotBlockOthers() throws Exception {
        Path broken = write("broken.md", START + "\n" + START + "\n");
        Path target = write("notes.md", "# Notes\n" + START + "\nv1\n" + END + "\n");
        rendered.put("broken", "x");
        DocsLifecycleService service = service(
                SectionConfig.managed("broken", "broken.md", "notes", null),
                notesSection("notes.md"));

        RunReport report = service.repair(Optional.empty());

        assertThat(report.status()).isEqualTo(RunStatus.ERROR);
        assertThat(report.section("broken").orElseThrow().status()).isEqualTo("corrupted");
        assertThat(report.section("broken").orElseThrow().action()).isEqualTo(SectionReport.SKIPPED);
        assertThat(report.issues()).extracting(Issue::code).containsExactly(IssueCode.CORRUPTED_MARKERS);
        assertThat(report.section("notes").orElseThrow().action()).isEqualTo(WriteOutcome.UPDATED);
        assertThat(Files.readString(broken)).isEqualTo(START + "\n" + START + "\n");
        assertThat(Files.readString(target)).contains("v2");
    }

    @Test
    void staleDiagnosisIsRejectedAsConflict() throws Exception {
        SectionConfig section = notesSection("notes.md");
        Path target = write("notes.md", "# Notes\n" + START + "\nv1\n" + END + "\n");
        RegionDiagnosis stale = new DiffEngine().diagnose(section, target, DesiredContent.of("v2"),
                Optional.of(Files.readString(target)));
        assertThat(stale.status()).isEqualTo(RegionStatus.DRIFT);
        String edited = "# Notes\n" + START + "\nhuman edit\n" + END + "\n";
        Files.writeString(target, edited, StandardCharsets.UTF_8);

        RunReport report = service(section).repair("notes", stale);

        assertThat(report.issues()).extracting(Issue::code).containsExactly(IssueCode.CONFLICT);
        assertThat(report.section("notes").orElseThrow().action()).isEqualTo(SectionReport.SKIPPED);
        assertThat(Files.readString(target)).isEqualTo(edited);
    }

    @Test
    void rollbackRestoresPreRepairBytes() throws Exception {
        String original = "# Notes\r\n" + START + "\r\nv1\r\n" + END + "\r\n";
        Path target = write("notes.md", original);
        DocsLifecycleService service = service(notesSection("notes.md"));
        String backup = service.repair(Optional.empty()).section("notes").orElseThrow().backup();

        RunReport rollback = service.rollback("notes", backup);

        assertThat(rollback.section("notes").orElseThrow().action()).isEqualTo(WriteOutcome.RESTORED);
        assertThat(Files.readString(target)).isEqualTo(original);
        assertThat(service.history("notes").section("notes").orElseThrow().snapshots()).hasSize(2);
    }

    @Test
    void rollbackToUnknownTimestampReportsBackupNotFound() throws Exception {
        write("notes.md", "# Notes\n");

        RunReport report = service(notesSection("notes.md")).rollback("notes", "2020-01-01T00:00:00Z");

        assertThat(report.issues()).extracting(Issue::code).containsExactly(IssueCode.BACKUP_NOT_FOUND);
        assertThat(report.status()).isEqualTo(RunStatus.ERROR);
    }

    @Test
    void adoptedContentBecomesTheBaseline() throws Exception {
        String edited = "# Notes\n" + START + "\nhand tuned\n" + END + "\n";
        Path target = write("notes.md", edited);
        DocsLifecycleService service = service(notesSection("notes.md"));

        RunReport adopt = service.adopt("notes");

        assertThat(adopt.section("notes").orElseThrow().action()).isEqualTo(SectionReport.ADOPTED);
        assertThat(service.diff("notes").section("notes").orElseThrow().status()).isEqualTo("match");
        assertThat(service.repair(Optional.empty()).section("notes").orElseThrow().action()).isEqualTo(WriteOutcome.NOOP);
        assertThat(Files.readString(target)).isEqualTo(edited);

        rendered.put("notes", "v3");
        assertThat(service.diff("notes").section("notes").orElseThrow().status()).isEqualTo("drift");
    }

    @Test
    void adoptRefusesErrorStates() throws Exception {
        write("notes.md", "# Notes\n");

        RunReport report = service(notesSection("notes.md")).adopt("notes");

        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo(IssueCode.MISSING_MARKER);
            assertThat(issue.isError()).isTrue();
        });
        assertThat(report.section("notes").orElseThrow().action()).isEqualTo(SectionReport.SKIPPED);
    }

    @Test
    void missingFileAndMissingContentAreErrors() throws Exception {
        DocsLifecycleService service = service(notesSection("absent.md"),
                SectionConfig.managed("unrendered", "notes.md", "other", null));
        write("notes.md", "text\n");

        RunReport report = service.repair(Optional.empty());

        assertThat(report.issues()).extracting(Issue::code)
                .containsExactly(IssueCode.MISSING_FILE, IssueCode.MISSING_CONTENT);
        assertThat(report.section("unrendered").orElseThrow().status()).isEqualTo(SectionReport.ERROR);
        assertThat(Files.exists(root.resolve("absent.md"))).isFalse();
    }

    @Test
    void unknownSectionIsReported() {
        RunReport report = service(notesSection("notes.md")).diff("nope");

        assertThat(report.sections()).isEmpty();
        assertThat(report.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo(IssueCode.UNKNOWN_SECTION);
            assertThat(issue.section()).isEqualTo("nope");
        });
    }

    @Test
    void syncRepairsExternalSectionsIdempotently() throws Exception {
        Path mkdocs = write("mkdocs.yml", "site_name: Demo\nnav:\n  - Home: index.md\n");
        rendered.put("page", "<p>Overview</p>");
        DocsLifecycleService service = service(
                SectionConfig.external("nav", null, AdapterKind.MKDOCS_NAV, Map.of("title", "Architecture")),
                SectionConfig.external("page", null, AdapterKind.CONFLUENCE_PAGE, Map.of("title", "Overview Page")));

        RunReport first = service.sync(Optional.empty());

        assertThat(first.section("nav").orElseThrow().status()).isEqualTo("drift");
        assertThat(first.section("nav").orElseThrow().action()).isEqualTo(WriteOutcome.UPDATED);
        assertThat(first.section("nav").orElseThrow().diff())
                .contains("\n+")
                .contains("Architecture: architecture/overview.md");
        assertThat(first.section("page").orElseThrow().status()).isEqualTo("missing_file");
        assertThat(first.section("page").orElseThrow().action()).isEqualTo(WriteOutcome.CREATED);
        assertThat(Files.readString(mkdocs)).contains("Architecture: architecture/overview.md");
        assertThat(stateDir.resolve("confluence/overview-page.json")).isRegularFile();

        RunReport second = service.sync(Optional.empty());
        assertThat(second.sections()).extracting(SectionReport::action).containsOnly(WriteOutcome.NOOP);
        assertThat(second.status()).isEqualTo(RunStatus.OK);
    }

    @Test
    void adoptIsUnsupportedForNavigationAdapters() throws Exception {
        write("mkdocs.yml", "nav: []\n");
        DocsLifecycleService service = service(
                SectionConfig.external("nav", null, AdapterKind.MKDOCS_NAV, Map.of()));

        RunReport report = service.adopt("nav");

        assertThat(report.issues()).extracting(Issue::code).containsExactly(IssueCode.UNSUPPORTED_OPERATION);
        assertThat(report.section("nav").orElseThrow().status()).isEqualTo(SectionReport.ERROR);
    }

    @Test
    void adoptOfConfluencePayloadKeepsEditedBody() throws Exception {
        rendered.put("page", "<p>generated</p>");
        DocsLifecycleService service = service(
                SectionConfig.external("page", "page.json", AdapterKind.CONFLUENCE_PAGE, Map.of()));
        service.repair(Optional.empty());
        Path payload = root.resolve("page.json");
        Files.writeString(payload, Files.readString(payload).replace("<p>generated</p>", "<p>edited</p>"));

        RunReport adopt = service.adopt("page");

        assertThat(adopt.section("page").orElseThrow().action()).isEqualTo(SectionReport.ADOPTED);
        String adopted = Files.readString(payload);
        assertThat(service.diff("page").section("page").orElseThrow().status()).isEqualTo("match");
        assertThat(service.repair(Optional.empty()).section("page").orElseThrow().action()).isEqualTo(WriteOutcome.NOOP);
        assertThat(Files.readString(payload)).isEqualTo(adopted).contains("<p>edited</p>");
    }

    private SectionConfig notesSection(String target) {
        return SectionConfig.managed("notes", target, "notes", new AnchorPolicy.AfterHeading("# Notes"));
    }

    private DocsLifecycleService service(SectionConfig... sections) {
        return new DocsLifecycleService(registry(sections), stateDir, this::render, new AtomicFileWriter(), CLOCK, 20);
    }

    private SectionRegistry registry(SectionConfig... sections) {
        return new SectionRegistry(Optional.empty(), root, root, List.of(sections));
    }

    private Optional<DesiredContent> render(String section) {
        return Optional.ofNullable(rendered.get(section)).map(DesiredContent::of);
    }

    private Path write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
