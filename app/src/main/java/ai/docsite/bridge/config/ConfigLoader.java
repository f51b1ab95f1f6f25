package ai.docsite.bridge.config;

import ai.docsite.bridge.backup.BackupStore;
import ai.docsite.bridge.cli.CliArguments;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_PROJECT_ROOT = "DOCS_BRIDGE_PROJECT_ROOT";
    static final String ENV_CONFIG = "DOCS_BRIDGE_CONFIG";
    static final String ENV_STATE_DIR = "DOCS_BRIDGE_STATE_DIR";
    static final String ENV_CONTENT_DIR = "DOCS_BRIDGE_CONTENT_DIR";
    static final String ENV_BACKUP_RETENTION = "DOCS_BRIDGE_BACKUP_RETENTION";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final Path DEFAULT_STATE_DIR = Path.of(".agentcontrol", "state", "docs");
    static final Path DEFAULT_CONTENT_DIR = DEFAULT_STATE_DIR.resolve("rendered");

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path projectRoot = resolvePath(arguments.projectRoot(), ENV_PROJECT_ROOT)
                .orElse(Path.of(""))
                .toAbsolutePath()
                .normalize();
        Optional<Path> configFile = resolvePath(arguments.configFile(), ENV_CONFIG)
                .map(path -> projectRoot.resolve(path).normalize());
        Path stateDirectory = projectRoot.resolve(resolvePath(arguments.stateDirectory(), ENV_STATE_DIR)
                .orElse(DEFAULT_STATE_DIR)).normalize();
        Path contentDirectory = projectRoot.resolve(resolvePath(arguments.contentDirectory(), ENV_CONTENT_DIR)
                .orElse(DEFAULT_CONTENT_DIR)).normalize();

        int backupRetention = environmentReader.get(ENV_BACKUP_RETENTION)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parsePositiveInteger)
                .orElse(BackupStore.DEFAULT_RETENTION);

        return new Config(projectRoot, configFile, stateDirectory, contentDirectory, backupRetention,
                resolveLogFormat(arguments));
    }

    private Optional<Path> resolvePath(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> toPath(envKey, value));
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static Path toPath(String envKey, String value) {
        try {
            return Path.of(value);
        } catch (InvalidPathException ex) {
            throw new IllegalArgumentException(envKey + " is not a valid path: " + value, ex);
        }
    }

    private static int parsePositiveInteger(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_BACKUP_RETENTION + " must be greater than zero");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_BACKUP_RETENTION + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
