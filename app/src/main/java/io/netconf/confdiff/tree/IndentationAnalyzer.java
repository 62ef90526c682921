package io.netconf.confdiff.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Splits configuration text into indented token lines and infers the document-wide indentation unit.
 */
public class IndentationAnalyzer {

    static final int TAB_WIDTH = 4;

    // Unicode line and paragraph separators, plus the ASCII form feed, vertical tab and file/group/record separators.
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|[\\n\\x0B\\f\\r\\x1C-\\x1E\\u0085\\u2028\\u2029]");
    // White_Space property (NBSP, ideographic space and friends) plus the ASCII information separators.
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\x1C-\\x1F]+", Pattern.UNICODE_CHARACTER_CLASS);

    public IndentationProfile analyze(String text) {
        Objects.requireNonNull(text, "text");

        List<IndentedLine> lines = new ArrayList<>();
        int lineNumber = 0;
        for (String raw : LINE_BREAK.split(text)) {
            lineNumber++;
            List<String> tokens = tokenize(raw);
            if (tokens.isEmpty()) {
                continue;
            }
            lines.add(new IndentedLine(lineNumber, rawIndent(raw), tokens));
        }

        int unit = inferUnit(lines.stream()
                .map(IndentedLine::rawIndent)
                .collect(Collectors.toList()));
        return new IndentationProfile(lines, unit);
    }

    /**
     * Width of the leading whitespace where a space counts 1 and a tab counts {@value #TAB_WIDTH}.
     */
    static int rawIndent(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (ch == ' ') {
                width++;
            } else if (ch == '\t') {
                width += TAB_WIDTH;
            } else {
                break;
            }
        }
        return width;
    }

    /**
     * Whitespace-separated tokens of the line; empty when the line holds nothing but whitespace.
     */
    static List<String> tokenize(String line) {
        return Arrays.stream(WHITESPACE.split(line))
                .filter(token -> !token.isEmpty())
                .toList();
    }

    /**
     * Smallest positive gap between consecutive distinct indent values; 1 when there is no such gap.
     */
    static int inferUnit(Collection<Integer> indents) {
        SortedSet<Integer> distinct = new TreeSet<>(indents);
        if (distinct.size() < 2) {
            return 1;
        }
        int unit = Integer.MAX_VALUE;
        Integer previous = null;
        for (Integer current : distinct) {
            if (previous != null) {
                int gap = current - previous;
                if (gap > 0 && gap < unit) {
                    unit = gap;
                }
            }
            previous = current;
        }
        return unit == Integer.MAX_VALUE || unit < 1 ? 1 : unit;
    }
}
