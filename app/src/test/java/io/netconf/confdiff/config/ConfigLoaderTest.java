package io.netconf.confdiff.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.netconf.confdiff.cli.CliArguments;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesCompareConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--ignore", "^!",
                "--context", "5",
                "--log-format", "json",
                "--verbose",
                "ref.cfg", "cmp.cfg");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.COMPARE);
        assertThat(config.referencePath()).isEqualTo(Path.of("ref.cfg"));
        assertThat(config.comparedPath()).contains(Path.of("cmp.cfg"));
        assertThat(config.ignorePattern()).isEqualTo("^!");
        assertThat(config.contextLines()).isEqualTo(5);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.verbose()).isTrue();
        assertThat(config.search()).isEqualTo(SearchSettings.defaults());
    }

    @Test
    void appliesDefaultsWhenNothingIsSet() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "ref.cfg", "cmp.cfg");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.ignorePattern()).isEmpty();
        assertThat(config.contextLines()).isEqualTo(3);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.verbose()).isFalse();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_IGNORE_PATTERN, "^description");
        envValues.put(ConfigLoader.ENV_CONTEXT_LINES, " 1 ");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "json");
        envValues.put(ConfigLoader.ENV_VERBOSE, "1");
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "ref.cfg", "cmp.cfg");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.ignorePattern()).isEqualTo("^description");
        assertThat(config.contextLines()).isEqualTo(1);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.verbose()).isTrue();
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_MODE, ConfigLoader.ENV_IGNORE_PATTERN);
    }

    @Test
    void cliValuesTakePrecedenceOverEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_MODE, "search",
                ConfigLoader.ENV_IGNORE_PATTERN, "^description",
                ConfigLoader.ENV_CONTEXT_LINES, "7"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "compare", "--ignore", "^!", "--context", "0", "ref.cfg", "cmp.cfg");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.COMPARE);
        assertThat(config.ignorePattern()).isEqualTo("^!");
        assertThat(config.contextLines()).isZero();
        assertThat(environmentReader.requestedKeys()).doesNotContain(ConfigLoader.ENV_IGNORE_PATTERN);
    }

    @Test
    void assemblesSearchConfig() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "search",
                "--prefix", "ip address",
                "--level", "1",
                "--parent-prefix", "interface",
                "ref.cfg");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.SEARCH);
        assertThat(config.comparedPath()).isEmpty();
        assertThat(config.search().prefix()).isEqualTo("ip address");
        assertThat(config.search().level()).isEqualTo(1);
        assertThat(config.search().parentPrefix()).contains("interface");
    }

    @Test
    void searchModeMayComeFromEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(ConfigLoader.ENV_MODE, "SEARCH"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--prefix", "hostname", "ref.cfg");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.mode()).isEqualTo(Mode.SEARCH);
        assertThat(config.search().level()).isZero();
    }

    @Test
    void compareModeRequiresComparedFile() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "ref.cfg");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("required in compare mode");
    }

    @Test
    void searchModeRejectsComparedFile() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--mode", "search", "ref.cfg", "cmp.cfg");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("only be used in compare mode");
    }

    @Test
    void searchOptionsOutsideSearchModeCauseValidationError() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--level", "1", "ref.cfg", "cmp.cfg");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("search mode");
    }

    @Test
    void negativeNumbersAreRejected() {
        CliArguments negativeContext = CommandLine.populateCommand(new CliArguments(), "--context", "-1", "ref.cfg", "cmp.cfg");
        CliArguments negativeLevel = CommandLine.populateCommand(new CliArguments(), "--mode", "search", "--level", "-2", "ref.cfg");
        ConfigLoader loader = new ConfigLoader(key -> Optional.empty());

        assertThat(catchThrowable(() -> loader.load(negativeContext))).hasMessageContaining("--context");
        assertThat(catchThrowable(() -> loader.load(negativeLevel))).hasMessageContaining("--level");
    }

    @Test
    void invalidEnvironmentValuesNameTheVariable() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "ref.cfg", "cmp.cfg");

        Throwable badContext = catchThrowable(() -> new ConfigLoader(
                new RecordingEnvironmentReader(Map.of(ConfigLoader.ENV_CONTEXT_LINES, "three"))).load(cliArguments));
        Throwable badFormat = catchThrowable(() -> new ConfigLoader(
                new RecordingEnvironmentReader(Map.of(ConfigLoader.ENV_LOG_FORMAT, "xml"))).load(cliArguments));

        assertThat(badContext)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_CONTEXT_LINES);
        assertThat(badFormat)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported log format");
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
