package io.netconf.confdiff.compare;

import io.netconf.confdiff.tree.ConfLine;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which lines are left out of a comparison based on a regular expression searched in the line text.
 */
final class IgnoreFilter implements Predicate<ConfLine> {

    private static final Logger LOGGER = LoggerFactory.getLogger(IgnoreFilter.class);
    private static final IgnoreFilter NONE = new IgnoreFilter(null);

    private final Pattern pattern;

    private IgnoreFilter(Pattern pattern) {
        this.pattern = pattern;
    }

    /**
     * An empty pattern ignores nothing. So does a malformed one, which is logged rather than thrown.
     */
    static IgnoreFilter compile(String regex) {
        if (regex == null || regex.isEmpty()) {
            return NONE;
        }
        try {
            return new IgnoreFilter(Pattern.compile(regex));
        } catch (PatternSyntaxException ex) {
            LOGGER.warn("Ignoring malformed ignore pattern '{}': {}", regex, ex.getDescription());
            return NONE;
        }
    }

    @Override
    public boolean test(ConfLine line) {
        return pattern != null && pattern.matcher(line.text()).find();
    }

    List<ConfLine> retain(List<ConfLine> lines) {
        if (pattern == null) {
            return lines;
        }
        return lines.stream().filter(this.negate()).toList();
    }
}
