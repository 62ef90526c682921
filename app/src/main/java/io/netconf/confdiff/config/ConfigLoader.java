package io.netconf.confdiff.config;

import io.netconf.confdiff.cli.CliArguments;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "CONFDIFF_MODE";
    static final String ENV_IGNORE_PATTERN = "CONFDIFF_IGNORE_PATTERN";
    static final String ENV_CONTEXT_LINES = "CONFDIFF_CONTEXT_LINES";
    static final String ENV_VERBOSE = "CONFDIFF_VERBOSE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final int DEFAULT_CONTEXT_LINES = 3;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Mode mode = resolveMode(arguments);
        Path referencePath = arguments.referencePath();
        if (referencePath == null) {
            throw new IllegalArgumentException("reference configuration file must be provided");
        }
        Optional<Path> comparedPath = Optional.ofNullable(arguments.comparedPath());

        String ignorePattern = Optional.ofNullable(arguments.ignorePattern())
                .or(() -> environmentReader.get(ENV_IGNORE_PATTERN).filter(ConfigLoader::isNotBlank))
                .orElse("");

        int contextLines = resolveContextLines(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        boolean verbose = resolveVerbose(arguments);

        SearchSettings search = new SearchSettings(
                arguments.searchPrefix(),
                resolveSearchLevel(arguments),
                Optional.ofNullable(arguments.parentPrefix()));
        if (!mode.isSearch() && hasSearchCriteria(arguments)) {
            throw new IllegalArgumentException("--prefix, --level and --parent-prefix can only be used in search mode");
        }

        return new Config(mode, referencePath, comparedPath, ignorePattern, contextLines, logFormat, verbose, search);
    }

    private Mode resolveMode(CliArguments arguments) {
        Mode cliMode = arguments.mode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_MODE)
                .filter(ConfigLoader::isNotBlank)
                .map(Mode::from)
                .orElse(Mode.COMPARE);
    }

    private int resolveContextLines(CliArguments arguments) {
        Integer cliValue = arguments.contextLines();
        if (cliValue != null) {
            if (cliValue < 0) {
                throw new IllegalArgumentException("--context must be zero or greater");
            }
            return cliValue;
        }
        return environmentReader.get(ENV_CONTEXT_LINES)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> parseNonNegativeInteger(value, ENV_CONTEXT_LINES))
                .orElse(DEFAULT_CONTEXT_LINES);
    }

    private int resolveSearchLevel(CliArguments arguments) {
        Integer level = arguments.searchLevel();
        if (level == null) {
            return 0;
        }
        if (level < 0) {
            throw new IllegalArgumentException("--level must be zero or greater");
        }
        return level;
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

    private boolean resolveVerbose(CliArguments arguments) {
        if (arguments.verbose()) {
            return true;
        }
        return environmentReader.get(ENV_VERBOSE)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private static boolean hasSearchCriteria(CliArguments arguments) {
        return arguments.searchPrefix() != null || arguments.searchLevel() != null || arguments.parentPrefix() != null;
    }

    private static int parseNonNegativeInteger(String raw, String name) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(name + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
