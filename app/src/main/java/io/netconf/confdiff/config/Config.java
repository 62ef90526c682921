package io.netconf.confdiff.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Mode mode,
        Path referencePath,
        Optional<Path> comparedPath,
        String ignorePattern,
        int contextLines,
        LogFormat logFormat,
        boolean verbose,
        SearchSettings search
) {

    public Config {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(referencePath, "referencePath");
        comparedPath = comparedPath == null ? Optional.empty() : comparedPath;
        ignorePattern = ignorePattern == null ? "" : ignorePattern;
        if (contextLines < 0) {
            throw new IllegalArgumentException("contextLines must be zero or greater");
        }
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        search = search == null ? SearchSettings.defaults() : search;
        if (mode == Mode.COMPARE && comparedPath.isEmpty()) {
            throw new IllegalArgumentException("a compared configuration file is required in compare mode");
        }
        if (mode == Mode.SEARCH && comparedPath.isPresent()) {
            throw new IllegalArgumentException("a compared configuration file can only be used in compare mode");
        }
    }
}
