package io.netconf.confdiff.cli;

import io.netconf.confdiff.config.LogFormat;
import io.netconf.confdiff.config.Mode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "netconf-confdiff", mixinStandardHelpOptions = true, version = "netconf-confdiff 1.0.0",
        description = "Compares indentation-structured device configurations, or searches one of them")
public class CliArguments {

    @CommandLine.Parameters(index = "0", paramLabel = "REFERENCE", description = "Reference (baseline) configuration file")
    private Path referencePath;

    @CommandLine.Parameters(index = "1", arity = "0..1", paramLabel = "COMPARED", description = "Configuration file compared against the reference")
    private Path comparedPath;

    @CommandLine.Option(names = "--mode", converter = OptionConverters.ModeConverter.class, description = "Execution mode: compare or search")
    private Mode mode;

    @CommandLine.Option(names = "--ignore", description = "Regular expression; lines whose text contains a match are left out of the comparison", paramLabel = "REGEX")
    private String ignorePattern;

    @CommandLine.Option(names = "--context", description = "Context lines around changes in subtree diffs", paramLabel = "LINES")
    private Integer contextLines;

    @CommandLine.Option(names = "--prefix", description = "Search: text the line must start with", paramLabel = "TEXT")
    private String searchPrefix;

    @CommandLine.Option(names = "--level", description = "Search: level the line must have", paramLabel = "LEVEL")
    private Integer searchLevel;

    @CommandLine.Option(names = "--parent-prefix", description = "Search: text the parent line must start with", paramLabel = "TEXT")
    private String parentPrefix;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = OptionConverters.LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    private boolean verbose;

    public Path referencePath() {
        return referencePath;
    }

    public Path comparedPath() {
        return comparedPath;
    }

    public Mode mode() {
        return mode;
    }

    public String ignorePattern() {
        return ignorePattern;
    }

    public Integer contextLines() {
        return contextLines;
    }

    public String searchPrefix() {
        return searchPrefix;
    }

    public Integer searchLevel() {
        return searchLevel;
    }

    public String parentPrefix() {
        return parentPrefix;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
