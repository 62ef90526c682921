package io.netconf.confdiff.tree;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses indentation-structured configuration text into a {@link ConfTree}.
 *
 * <p>Parsing accepts any text; blank lines are dropped and comment-like lines are kept as ordinary
 * lines. The only failure is an I/O error while reading a file, which is passed through unchanged.
 */
public class ConfParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfParser.class);

    private final IndentationAnalyzer analyzer;
    private final TreeBuilder treeBuilder;

    public ConfParser() {
        this(new IndentationAnalyzer(), new TreeBuilder());
    }

    public ConfParser(IndentationAnalyzer analyzer, TreeBuilder treeBuilder) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.treeBuilder = Objects.requireNonNull(treeBuilder, "treeBuilder");
    }

    public ConfTree parse(String text) {
        IndentationProfile profile = analyzer.analyze(text);
        ConfTree tree = treeBuilder.build(profile);
        LOGGER.debug("Parsed {} lines ({} roots) using indentation unit {}",
                tree.size(), tree.roots().size(), profile.unit());
        return tree;
    }

    public ConfTree parseFile(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        String text = Files.readString(path, StandardCharsets.UTF_8);
        LOGGER.debug("Read {} characters from {}", text.length(), path);
        return parse(text);
    }
}
