package ai.docsite.bridge.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration of one docs bridge invocation.
 *
 * @param configFile explicit bridge configuration file; empty to use the default locations
 * @param stateDirectory root of backups, baselines and generated payloads
 * @param contentDirectory directory holding rendered {@code <section>.md} files
 */
public record Config(
        Path projectRoot,
        Optional<Path> configFile,
        Path stateDirectory,
        Path contentDirectory,
        int backupRetention,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(projectRoot, "projectRoot");
        configFile = configFile == null ? Optional.empty() : configFile;
        Objects.requireNonNull(stateDirectory, "stateDirectory");
        Objects.requireNonNull(contentDirectory, "contentDirectory");
        Objects.requireNonNull(logFormat, "logFormat");
        if (backupRetention < 1) {
            throw new IllegalArgumentException("backupRetention must be positive");
        }
    }
}
