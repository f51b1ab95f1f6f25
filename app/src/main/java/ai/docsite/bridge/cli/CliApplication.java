package ai.docsite.bridge.cli;

import ai.docsite.bridge.config.Config;
import ai.docsite.bridge.config.ConfigLoader;
import ai.docsite.bridge.config.SystemEnvironmentReader;
import ai.docsite.bridge.content.RenderedDirectoryContentProvider;
import ai.docsite.bridge.issue.DocsBridgeException;
import ai.docsite.bridge.issue.Issue;
import ai.docsite.bridge.issue.IssueCode;
import ai.docsite.bridge.issue.Severity;
import ai.docsite.bridge.lifecycle.DocsLifecycleService;
import ai.docsite.bridge.lifecycle.RunReport;
import ai.docsite.bridge.logging.LoggingConfigurator;
import ai.docsite.bridge.registry.SectionRegistry;
import ai.docsite.bridge.registry.SectionRegistryLoader;
import ai.docsite.bridge.writer.AtomicFileWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and lifecycle service.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final String MDC_COMMAND = "command";

    private final ConfigLoader configLoader;
    private final SectionRegistryLoader registryLoader;
    private final Clock clock;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new SectionRegistryLoader(), Clock.systemUTC(),
                new PrintWriter(System.out, true), new PrintWriter(System.err, true));
    }

    CliApplication(ConfigLoader configLoader, SectionRegistryLoader registryLoader, Clock clock,
                   PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.registryLoader = registryLoader;
        this.clock = clock;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        CommandLine.ParseResult parseResult;
        try {
            parseResult = commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            ex.getCommandLine().usage(err);
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (CommandLine.printHelpIfRequested(parseResult)) {
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }

        if (!parseResult.hasSubcommand()) {
            err.println("Missing command");
            commandLine.usage(err);
            err.flush();
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        CommandLine.ParseResult verbResult = parseResult.subcommand();
        String command = verbResult.commandSpec().name();
        CliArguments.Verb verb = (CliArguments.Verb) verbResult.commandSpec().userObject();
        ReportPrinter printer = new ReportPrinter(out);

        MDC.put(MDC_COMMAND, command);
        try {
            Config config;
            try {
                config = configLoader.load(cliArguments);
            } catch (IllegalArgumentException ex) {
                return fail(printer, command, verb, IssueCode.INVALID_CONFIG, null, ex.getMessage());
            }
            LoggingConfigurator.configure(config.logFormat());
            LOGGER.debug("Running {} for project {}", command, config.projectRoot());

            SectionRegistry registry;
            try {
                registry = registryLoader.load(config.projectRoot(), config.configFile());
            } catch (DocsBridgeException ex) {
                LOGGER.error("Invalid docs bridge configuration: {}", ex.getMessage());
                return fail(printer, command, verb, ex);
            }

            DocsLifecycleService service = new DocsLifecycleService(registry, config.stateDirectory(),
                    new RenderedDirectoryContentProvider(config.contentDirectory()), new AtomicFileWriter(), clock,
                    config.backupRetention());
            RunReport report = dispatch(service, verb);
            printer.print(report, verb.json());
            return report.status().exitCode();
        } catch (DocsBridgeException ex) {
            return fail(printer, command, verb, ex);
        } catch (UncheckedIOException ex) {
            LOGGER.error("I/O failure while running {}", command, ex);
            return fail(printer, command, verb, IssueCode.IO_FAILURE, null, ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.error("Unexpected failure while running {}", command, ex);
            return fail(printer, command, verb, IssueCode.INTERNAL_ERROR, null, String.valueOf(ex.getMessage()));
        } finally {
            MDC.remove(MDC_COMMAND);
        }
    }

    private RunReport dispatch(DocsLifecycleService service, CliArguments.Verb verb) {
        if (verb instanceof CliArguments.Diagnose) {
            return service.diagnose();
        }
        if (verb instanceof CliArguments.ListSections) {
            return service.list();
        }
        if (verb instanceof CliArguments.Diff diff) {
            return service.diff(diff.section());
        }
        if (verb instanceof CliArguments.Repair repair) {
            return service.repair(Optional.ofNullable(repair.section()));
        }
        if (verb instanceof CliArguments.Adopt adopt) {
            return service.adopt(adopt.section());
        }
        if (verb instanceof CliArguments.Rollback rollback) {
            return service.rollback(rollback.section(), rollback.timestamp());
        }
        if (verb instanceof CliArguments.Sync sync) {
            return service.sync(Optional.ofNullable(sync.section()));
        }
        if (verb instanceof CliArguments.History history) {
            return service.history(history.section());
        }
        throw new IllegalStateException("Unhandled command " + verb.getClass().getSimpleName());
    }

    private int fail(ReportPrinter printer, String command, CliArguments.Verb verb, DocsBridgeException ex) {
        return report(printer, command, verb, Issue.from(ex, ex.section()));
    }

    private int fail(ReportPrinter printer, String command, CliArguments.Verb verb, IssueCode code, String path, String message) {
        return report(printer, command, verb, new Issue(code, Severity.ERROR, null, path, message, null));
    }

    private int report(ReportPrinter printer, String command, CliArguments.Verb verb, Issue issue) {
        RunReport report = new RunReport(command, clock.instant(), List.of(), List.of(issue));
        printer.print(report, verb.json());
        return report.status().exitCode();
    }
}
