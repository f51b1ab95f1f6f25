package ai.docsite.bridge.cli;

import ai.docsite.bridge.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "docs-bridge", mixinStandardHelpOptions = true,
        description = "Keeps generated regions of existing documentation in sync",
        subcommands = {
                CliArguments.Diagnose.class,
                CliArguments.ListSections.class,
                CliArguments.Diff.class,
                CliArguments.Repair.class,
                CliArguments.Adopt.class,
                CliArguments.Rollback.class,
                CliArguments.Sync.class,
                CliArguments.History.class
        })
public class CliArguments {

    @CommandLine.Option(names = "--project", description = "Project root (default: current directory)", paramLabel = "DIR")
    private Path projectRoot;

    @CommandLine.Option(names = "--config", description = "Bridge configuration file", paramLabel = "FILE")
    private Path configFile;

    @CommandLine.Option(names = "--state-dir", description = "Directory for backups, baselines and payloads", paramLabel = "DIR")
    private Path stateDirectory;

    @CommandLine.Option(names = "--content-dir", description = "Directory with rendered <section>.md files", paramLabel = "DIR")
    private Path contentDirectory;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path projectRoot() {
        return projectRoot;
    }

    public Path configFile() {
        return configFile;
    }

    public Path stateDirectory() {
        return stateDirectory;
    }

    public Path contentDirectory() {
        return contentDirectory;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    /**
     * Options shared by every verb.
     */
    public abstract static class Verb {

        @CommandLine.Option(names = "--json", description = "Print a JSON report instead of text")
        private boolean json;

        public boolean json() {
            return json;
        }
    }

    /**
     * Verbs that accept an optional section filter.
     */
    public abstract static class OptionalSectionVerb extends Verb {

        @CommandLine.Option(names = "--section", description = "Only process this section", paramLabel = "NAME")
        private String section;

        public String section() {
            return section;
        }
    }

    /**
     * Verbs bound to exactly one section.
     */
    public abstract static class SectionVerb extends Verb {

        @CommandLine.Option(names = "--section", required = true, description = "Section name", paramLabel = "NAME")
        private String section;

        public String section() {
            return section;
        }
    }

    @CommandLine.Command(name = "diagnose", mixinStandardHelpOptions = true, description = "Classify every section without modifying files")
    public static class Diagnose extends Verb {
    }

    @CommandLine.Command(name = "list", mixinStandardHelpOptions = true, description = "List sections with their mode, target, marker and status")
    public static class ListSections extends Verb {
    }

    @CommandLine.Command(name = "diff", mixinStandardHelpOptions = true, description = "Show the diff of one section")
    public static class Diff extends SectionVerb {
    }

    @CommandLine.Command(name = "repair", mixinStandardHelpOptions = true, description = "Restore drifting or missing managed regions")
    public static class Repair extends OptionalSectionVerb {
    }

    @CommandLine.Command(name = "adopt", mixinStandardHelpOptions = true, description = "Accept the current on-disk content of a section")
    public static class Adopt extends SectionVerb {
    }

    @CommandLine.Command(name = "rollback", mixinStandardHelpOptions = true, description = "Restore a section's target from a backup")
    public static class Rollback extends SectionVerb {

        @CommandLine.Option(names = "--timestamp", required = true, description = "Backup timestamp (ISO-8601 or backup id)", paramLabel = "TS")
        private String timestamp;

        public String timestamp() {
            return timestamp;
        }
    }

    @CommandLine.Command(name = "sync", mixinStandardHelpOptions = true, description = "Diff and repair in one step")
    public static class Sync extends OptionalSectionVerb {
    }

    @CommandLine.Command(name = "history", mixinStandardHelpOptions = true, description = "List the backups recorded for a section")
    public static class History extends SectionVerb {
    }
}
