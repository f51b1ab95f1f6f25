package ai.docsite.bridge.lifecycle;

import ai.docsite.bridge.adapter.AdapterEvaluation;
import ai.docsite.bridge.adapter.ExternalAdapter;
import ai.docsite.bridge.adapter.ExternalAdapters;
import ai.docsite.bridge.backup.BackupSnapshot;
import ai.docsite.bridge.backup.BackupStore;
import ai.docsite.bridge.content.AdoptedBaseline;
import ai.docsite.bridge.content.BaselineAwareContentProvider;
import ai.docsite.bridge.content.BaselineStore;
import ai.docsite.bridge.content.ContentHash;
import ai.docsite.bridge.content.DesiredContent;
import ai.docsite.bridge.content.DesiredContentProvider;
import ai.docsite.bridge.diff.DiffEngine;
import ai.docsite.bridge.diff.RegionDiagnosis;
import ai.docsite.bridge.diff.RegionStatus;
import ai.docsite.bridge.issue.DocsBridgeException;
import ai.docsite.bridge.issue.Issue;
import ai.docsite.bridge.issue.IssueCode;
import ai.docsite.bridge.issue.Severity;
import ai.docsite.bridge.registry.SectionConfig;
import ai.docsite.bridge.registry.SectionRegistry;
import ai.docsite.bridge.writer.AtomicFileWriter;
import ai.docsite.bridge.writer.ManagedRegionWriter;
import ai.docsite.bridge.writer.WriteOutcome;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the docs bridge verbs over the sections of a registry. Sections are processed one at a time
 * in configuration order, and a failing section never stops the others.
 */
public class DocsLifecycleService {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocsLifecycleService.class);

    static final String MDC_SECTION = "section";
    private static final String CURRENT_LABEL = "current";
    private static final String DESIRED_LABEL = "desired";

    private final SectionRegistry registry;
    private final Path stateDirectory;
    private final BaselineAwareContentProvider contentProvider;
    private final BaselineStore baselineStore;
    private final BackupStore backupStore;
    private final ManagedRegionWriter writer;
    private final DiffEngine diffEngine;
    private final ExternalAdapters adapters;
    private final Clock clock;

    public DocsLifecycleService(SectionRegistry registry, Path stateDirectory, DesiredContentProvider renderer) {
        this(registry, stateDirectory, renderer, new AtomicFileWriter(), Clock.systemUTC(), BackupStore.DEFAULT_RETENTION);
    }

    public DocsLifecycleService(SectionRegistry registry, Path stateDirectory, DesiredContentProvider renderer,
                                AtomicFileWriter fileWriter, Clock clock, int backupRetention) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.stateDirectory = Objects.requireNonNull(stateDirectory, "stateDirectory").toAbsolutePath().normalize();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.baselineStore = new BaselineStore(this.stateDirectory, fileWriter);
        this.contentProvider = new BaselineAwareContentProvider(renderer, baselineStore);
        this.backupStore = new BackupStore(this.stateDirectory, fileWriter, clock, backupRetention);
        this.writer = new ManagedRegionWriter(fileWriter, backupStore);
        this.diffEngine = new DiffEngine();
        this.adapters = ExternalAdapters.defaults();
    }

    /**
     * Classifies every section without touching any file.
     */
    public RunReport diagnose() {
        return runSelected("diagnose", Optional.empty(), (section, issues) -> inspect(section, issues, false));
    }

    /**
     * Like {@link #diagnose()}; the configuration columns are what callers display.
     */
    public RunReport list() {
        return runSelected("list", Optional.empty(), (section, issues) -> inspect(section, issues, false));
    }

    public RunReport diff(String sectionName) {
        return runSelected("diff", Optional.of(sectionName), (section, issues) -> inspect(section, issues, true));
    }

    public RunReport repair(Optional<String> sectionName) {
        return runSelected("repair", sectionName, (section, issues) -> repairSection(section, issues, false));
    }

    /**
     * Repairs a section from an earlier diagnosis. The host file is rechecked against the hash the
     * diagnosis observed, so edits made in between are reported as conflicts instead of overwritten.
     */
    public RunReport repair(String sectionName, RegionDiagnosis diagnosis) {
        Objects.requireNonNull(diagnosis, "diagnosis");
        return runSelected("repair", Optional.of(sectionName), (section, issues) -> {
            Path target = managedTarget(section);
            SectionReport.Builder report = describeManaged(base(section, target), diagnosis, false);
            return applyManagedRepair(section, target, diagnosis, issues, report);
        });
    }

    /**
     * Diff followed by repair of drifting or missing regions; reports the status seen before acting.
     */
    public RunReport sync(Optional<String> sectionName) {
        return runSelected("sync", sectionName, (section, issues) -> repairSection(section, issues, true));
    }

    public RunReport adopt(String sectionName) {
        return runSelected("adopt", Optional.of(sectionName), this::adoptSection);
    }

    public RunReport rollback(String sectionName, String timestamp) {
        return runSelected("rollback", Optional.of(sectionName), (section, issues) -> {
            Path target = targetOf(section);
            BackupSnapshot snapshot = backupStore.find(section.name(), timestamp)
                    .orElseThrow(() -> new DocsBridgeException(IssueCode.BACKUP_NOT_FOUND, section.name(), display(target),
                            "No backup '" + timestamp + "' recorded for section " + section.name()));
            WriteOutcome outcome = writer.restore(section, target, snapshot);
            LOGGER.info("Rolled back section {} to {}", section.name(), snapshot.id());
            return base(section, target)
                    .action(outcome.action())
                    .backup(outcome.backup().map(BackupSnapshot::id).orElse(null))
                    .detail("restored backup " + snapshot.id())
                    .build();
        });
    }

    public RunReport history(String sectionName) {
        return runSelected("history", Optional.of(sectionName), (section, issues) -> base(section, targetOf(section))
                .snapshots(backupStore.list(section.name()))
                .build());
    }

    @FunctionalInterface
    private interface SectionAction {
        SectionReport apply(SectionConfig section, List<Issue> issues);
    }

    private record ExternalState(ExternalAdapter adapter, Path target, Optional<String> current, AdapterEvaluation evaluation) {
    }

    private RunReport runSelected(String command, Optional<String> sectionName, SectionAction action) {
        List<SectionConfig> selected;
        try {
            selected = sectionName.map(name -> List.of(registry.require(name))).orElse(registry.sections());
        } catch (DocsBridgeException ex) {
            return new RunReport(command, clock.instant(), List.of(), List.of(Issue.from(ex, sectionName.orElse(null))));
        }
        List<SectionReport> reports = new ArrayList<>();
        List<Issue> issues = new ArrayList<>();
        for (SectionConfig section : selected) {
            MDC.put(MDC_SECTION, section.name());
            try {
                reports.add(action.apply(section, issues));
            } catch (DocsBridgeException ex) {
                LOGGER.warn("Section {} failed: {}", section.name(), ex.getMessage());
                issues.add(Issue.from(ex, section.name()));
                reports.add(errorReport(section, ex.path(), ex.getMessage()));
            } catch (UncheckedIOException ex) {
                LOGGER.error("I/O failure on section {}", section.name(), ex);
                issues.add(new Issue(IssueCode.IO_FAILURE, Severity.ERROR, section.name(), null, ex.getMessage(), null));
                reports.add(errorReport(section, null, ex.getMessage()));
            } finally {
                MDC.remove(MDC_SECTION);
            }
        }
        RunReport report = new RunReport(command, clock.instant(), reports, issues);
        LOGGER.info("{} finished with status {} ({} sections, {} issues)", command, report.status().label(),
                reports.size(), issues.size());
        return report;
    }

    private SectionReport inspect(SectionConfig section, List<Issue> issues, boolean withDiff) {
        if (section.isExternal()) {
            ExternalState state = evaluateExternal(section);
            externalIssue(section, state).ifPresent(issues::add);
            return describeExternal(base(section, state.target()), state, withDiff).build();
        }
        Path target = managedTarget(section);
        RegionDiagnosis diagnosis = diagnoseManaged(section, target);
        statusIssue(section, target, diagnosis).ifPresent(issues::add);
        return describeManaged(base(section, target), diagnosis, withDiff).build();
    }

    private SectionReport repairSection(SectionConfig section, List<Issue> issues, boolean withDiff) {
        if (section.isExternal()) {
            return repairExternal(section, issues, withDiff);
        }
        Path target = managedTarget(section);
        RegionDiagnosis diagnosis = diagnoseManaged(section, target);
        SectionReport.Builder report = describeManaged(base(section, target), diagnosis, withDiff);
        return applyManagedRepair(section, target, diagnosis, issues, report);
    }

    private SectionReport applyManagedRepair(SectionConfig section, Path target, RegionDiagnosis diagnosis,
                                             List<Issue> issues, SectionReport.Builder report) {
        RegionStatus status = diagnosis.status();
        if (status == RegionStatus.MATCH) {
            return report.action(WriteOutcome.NOOP).build();
        }
        if (!status.isRepairable()) {
            statusIssue(section, target, diagnosis).ifPresent(issues::add);
            return report.action(SectionReport.SKIPPED).build();
        }
        try {
            WriteOutcome outcome = writer.apply(section, target, diagnosis);
            return report.action(outcome.action())
                    .backup(outcome.backup().map(BackupSnapshot::id).orElse(null))
                    .build();
        } catch (DocsBridgeException ex) {
            LOGGER.warn("Repair of section {} refused: {}", section.name(), ex.getMessage());
            issues.add(Issue.from(ex, section.name()));
            return report.action(SectionReport.SKIPPED).detail(ex.getMessage()).build();
        }
    }

    private SectionReport repairExternal(SectionConfig section, List<Issue> issues, boolean withDiff) {
        ExternalState state = evaluateExternal(section);
        AdapterEvaluation evaluation = state.evaluation();
        SectionReport.Builder report = describeExternal(base(section, state.target()), state, withDiff);
        if (evaluation.status() == RegionStatus.MATCH) {
            return report.action(WriteOutcome.NOOP).build();
        }
        if (!evaluation.writable()) {
            externalIssue(section, state).ifPresent(issues::add);
            return report.action(SectionReport.SKIPPED).build();
        }
        try {
            WriteOutcome outcome = writer.replaceFile(section, state.target(), state.current().map(ContentHash::sha256),
                    evaluation.proposed().orElseThrow());
            return report.action(outcome.action())
                    .backup(outcome.backup().map(BackupSnapshot::id).orElse(null))
                    .build();
        } catch (DocsBridgeException ex) {
            LOGGER.warn("Repair of section {} refused: {}", section.name(), ex.getMessage());
            issues.add(Issue.from(ex, section.name()));
            return report.action(SectionReport.SKIPPED).detail(ex.getMessage()).build();
        }
    }

    private SectionReport adoptSection(SectionConfig section, List<Issue> issues) {
        if (section.isExternal()) {
            return adoptExternal(section);
        }
        Path target = managedTarget(section);
        RegionDiagnosis diagnosis = diagnoseManaged(section, target);
        SectionReport.Builder report = describeManaged(base(section, target), diagnosis, false);
        if (diagnosis.status() == RegionStatus.MATCH) {
            return report.action(WriteOutcome.NOOP).build();
        }
        if (diagnosis.status() != RegionStatus.DRIFT) {
            IssueCode code = diagnosis.status().issueCode().orElse(IssueCode.UNSUPPORTED_OPERATION);
            issues.add(new Issue(code, Severity.ERROR, section.name(), display(target),
                    "Cannot adopt section " + section.name() + " while it is " + diagnosis.status().label(), null));
            return report.action(SectionReport.SKIPPED).build();
        }
        BackupSnapshot snapshot = recordBaseline(section, target, ContentHash.normalize(diagnosis.region().innerContent()));
        return report.action(SectionReport.ADOPTED).backup(snapshot.id()).build();
    }

    private SectionReport adoptExternal(SectionConfig section) {
        ExternalAdapter adapter = adapterFor(section);
        Path target = adapter.resolveTarget(section, registry, stateDirectory);
        if (!adapter.supportsAdopt()) {
            throw new DocsBridgeException(IssueCode.UNSUPPORTED_OPERATION, section.name(), display(target),
                    "Adapter " + adapter.kind().label() + " does not support adopt");
        }
        ExternalState state = evaluateExternal(section);
        SectionReport.Builder report = describeExternal(base(section, target), state, false);
        if (state.current().isEmpty()) {
            throw new DocsBridgeException(IssueCode.MISSING_FILE, section.name(), display(target),
                    "Nothing to adopt: " + display(target) + " does not exist");
        }
        if (state.evaluation().status() == RegionStatus.MATCH) {
            return report.action(WriteOutcome.NOOP).build();
        }
        String content = adapter.adoptedContent(section, target, state.current().get());
        BackupSnapshot snapshot = recordBaseline(section, target, ContentHash.normalize(content));
        return report.action(SectionReport.ADOPTED).backup(snapshot.id()).build();
    }

    private BackupSnapshot recordBaseline(SectionConfig section, Path target, String content) {
        DesiredContent rendered = contentProvider.renderWithoutBaseline(section.name())
                .orElseThrow(() -> missingContent(section, target));
        BackupSnapshot snapshot = writer.snapshot(section, target);
        baselineStore.save(new AdoptedBaseline(section.name(), content, null, rendered.hash(), clock.instant().toString()));
        LOGGER.info("Adopted current content of section {} as its baseline", section.name());
        return snapshot;
    }

    private RegionDiagnosis diagnoseManaged(SectionConfig section, Path target) {
        DesiredContent desired = contentProvider.render(section.name()).orElseThrow(() -> missingContent(section, target));
        return diffEngine.diagnose(section, target, desired, writer.read(target));
    }

    private ExternalState evaluateExternal(SectionConfig section) {
        ExternalAdapter adapter = adapterFor(section);
        Path target = adapter.resolveTarget(section, registry, stateDirectory);
        DesiredContent desired = adapter.requiresContent()
                ? contentProvider.render(section.name()).orElseThrow(() -> missingContent(section, target))
                : DesiredContent.empty();
        Optional<String> current = writer.read(target);
        return new ExternalState(adapter, target, current, adapter.evaluate(section, desired, current));
    }

    private SectionReport.Builder describeManaged(SectionReport.Builder report, RegionDiagnosis diagnosis, boolean withDiff) {
        report.status(diagnosis.status().label())
                .contentHash(diagnosis.region().contentHash().orElse(null))
                .expectedHash(diagnosis.desired().hash())
                .detail(diagnosis.detail().orElse(null));
        if (withDiff) {
            diagnosis.diff().ifPresent(diff -> report.diff(diff.render(CURRENT_LABEL, DESIRED_LABEL)));
        }
        return report;
    }

    private SectionReport.Builder describeExternal(SectionReport.Builder report, ExternalState state, boolean withDiff) {
        AdapterEvaluation evaluation = state.evaluation();
        report.status(evaluation.status().label())
                .contentHash(state.current().map(ContentHash::sha256).orElse(null))
                .expectedHash(evaluation.proposed().map(ContentHash::sha256).orElse(null))
                .detail(evaluation.detail());
        if (withDiff && evaluation.status() != RegionStatus.MATCH && evaluation.proposed().isPresent()) {
            String current = ContentHash.normalize(state.current().orElse(""));
            String proposed = ContentHash.normalize(evaluation.proposed().get());
            report.diff(diffEngine.lineDiff(current, proposed).render(CURRENT_LABEL, DESIRED_LABEL));
        }
        return report;
    }

    private Optional<Issue> statusIssue(SectionConfig section, Path target, RegionDiagnosis diagnosis) {
        String path = display(target);
        String name = section.name();
        String detail = diagnosis.detail().map(reason -> ": " + reason).orElse("");
        switch (diagnosis.status()) {
            case MATCH:
                return Optional.empty();
            case DRIFT:
                String counts = diagnosis.diff()
                        .map(diff -> " (+" + diff.added() + " -" + diff.removed() + " lines)")
                        .orElse("");
                return Optional.of(Issue.of(IssueCode.DRIFT, name, path,
                        "Section " + name + " differs from generated content" + counts));
            case MISSING_FILE:
                return Optional.of(Issue.of(IssueCode.MISSING_FILE, name, path, "Target file " + path + " does not exist"));
            case MISSING_MARKER:
                return Optional.of(Issue.of(IssueCode.MISSING_MARKER, name, path,
                        "Managed markers for section " + name + " are missing in " + path));
            case DUPLICATE_MARKER:
                return Optional.of(Issue.of(IssueCode.DUPLICATE_MARKER, name, path,
                        "Duplicate managed markers for section " + name + " in " + path + detail));
            default:
                return Optional.of(Issue.of(IssueCode.CORRUPTED_MARKERS, name, path,
                        "Corrupted managed markers for section " + name + " in " + path + detail));
        }
    }

    private Optional<Issue> externalIssue(SectionConfig section, ExternalState state) {
        AdapterEvaluation evaluation = state.evaluation();
        String path = display(state.target());
        if (evaluation.blocker().isPresent()) {
            return Optional.of(Issue.of(evaluation.blocker().get(), section.name(), path, evaluation.detail()));
        }
        switch (evaluation.status()) {
            case MATCH:
                return Optional.empty();
            case MISSING_FILE:
                if (evaluation.proposed().isPresent()) {
                    return Optional.of(Issue.of(IssueCode.DRIFT, section.name(), path, evaluation.detail()));
                }
                return Optional.of(Issue.of(IssueCode.MISSING_FILE, section.name(), path,
                        "Target file " + path + " does not exist"));
            case DRIFT:
                return Optional.of(Issue.of(IssueCode.DRIFT, section.name(), path, evaluation.detail()));
            default:
                return Optional.of(Issue.of(IssueCode.CORRUPTED_TARGET, section.name(), path, evaluation.detail()));
        }
    }

    private SectionReport.Builder base(SectionConfig section, Path target) {
        SectionReport.Builder report = SectionReport.builder(section.name())
                .mode(section.mode().label())
                .target(target == null ? null : display(target));
        if (section.isExternal()) {
            report.adapter(section.adapter().map(kind -> kind.label()).orElse(null));
        } else {
            report.marker(section.marker()).anchor(section.anchor().describe());
        }
        return report;
    }

    private SectionReport errorReport(SectionConfig section, String path, String message) {
        return base(section, null)
                .target(path)
                .status(SectionReport.ERROR)
                .detail(message)
                .build();
    }

    private Path targetOf(SectionConfig section) {
        return section.isExternal()
                ? adapterFor(section).resolveTarget(section, registry, stateDirectory)
                : managedTarget(section);
    }

    private Path managedTarget(SectionConfig section) {
        return registry.targetPath(section).orElseThrow(() -> DocsBridgeException.invalidConfig(
                registry.source().map(Path::toString).orElse(null), "Section " + section.name() + " has no target"));
    }

    private ExternalAdapter adapterFor(SectionConfig section) {
        return adapters.forKind(section.adapter().orElseThrow(() -> DocsBridgeException.invalidConfig(
                registry.source().map(Path::toString).orElse(null), "Section " + section.name() + " has no adapter")));
    }

    private DocsBridgeException missingContent(SectionConfig section, Path target) {
        return new DocsBridgeException(IssueCode.MISSING_CONTENT, section.name(), display(target),
                "No generated content available for section " + section.name());
    }

    private String display(Path target) {
        return registry.relativize(target).toString();
    }
}
