package io.netconf.confdiff.cli;

import io.netconf.confdiff.compare.ComparisonResult;
import io.netconf.confdiff.compare.ConfComparator;
import io.netconf.confdiff.config.Config;
import io.netconf.confdiff.config.ConfigLoader;
import io.netconf.confdiff.config.SearchSettings;
import io.netconf.confdiff.config.SystemEnvironmentReader;
import io.netconf.confdiff.logging.LoggingConfigurator;
import io.netconf.confdiff.report.ComparisonReportRenderer;
import io.netconf.confdiff.search.ConfSearch;
import io.netconf.confdiff.tree.ConfLine;
import io.netconf.confdiff.tree.ConfParser;
import io.netconf.confdiff.tree.ConfTree;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader, parser and comparator.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_DIFFERENCES = 1;
    static final int EXIT_FAILURE = 2;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final ConfParser parser;
    private final ConfComparator comparator;
    private final ConfSearch confSearch;
    private final PrintWriter out;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new ConfParser(), new ConfComparator(), new ConfSearch(),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true));
    }

    CliApplication(ConfigLoader configLoader, ConfParser parser, ConfComparator comparator, ConfSearch confSearch, PrintWriter out) {
        this.configLoader = configLoader;
        this.parser = parser;
        this.comparator = comparator;
        this.confSearch = confSearch;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            out.flush();
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            return EXIT_FAILURE;
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());

        try {
            return switch (config.mode()) {
                case COMPARE -> compare(config);
                case SEARCH -> search(config);
            };
        } catch (IOException ex) {
            LOGGER.error("Failed to read configuration file: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private int compare(Config config) throws IOException {
        Path comparedPath = config.comparedPath().orElseThrow();
        ConfTree reference = parser.parseFile(config.referencePath());
        ConfTree compared = parser.parseFile(comparedPath);
        LOGGER.info("Comparing {} ({} lines) with {} ({} lines)",
                config.referencePath(), reference.size(), comparedPath, compared.size());

        ComparisonResult result = comparator.compare(reference, compared, config.ignorePattern());
        out.print(new ComparisonReportRenderer(config.contextLines()).render(result));
        out.flush();
        return result.hasDifferences() ? EXIT_DIFFERENCES : EXIT_OK;
    }

    private int search(Config config) throws IOException {
        ConfTree tree = parser.parseFile(config.referencePath());
        SearchSettings settings = config.search();
        List<ConfLine> matches = confSearch.search(tree, settings.prefix(), settings.level(), settings.parentPrefix());
        LOGGER.info("Found {} line(s) at level {} starting with '{}' in {}",
                matches.size(), settings.level(), settings.prefix(), config.referencePath());
        for (ConfLine line : matches) {
            out.println(line.lineNumber() + ": " + line.text());
        }
        out.flush();
        return EXIT_OK;
    }
}
