package io.netconf.confdiff.search;

import io.netconf.confdiff.tree.ConfLine;
import io.netconf.confdiff.tree.ConfTree;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Linear filter over the flat line list of a {@link ConfTree}.
 *
 * <p>Prefixes are compared against the space-joined line text with {@link String#startsWith}, so they are
 * not aligned to token boundaries: {@code "ip"} matches {@code "ipaddresses"} but {@code "address"} does
 * not match {@code "ip address x"}.
 */
public class ConfSearch {

    public List<ConfLine> search(ConfTree tree, String prefix, int level) {
        return search(tree, prefix, level, Optional.empty());
    }

    public List<ConfLine> search(ConfTree tree, String prefix, int level, String parentPrefix) {
        return search(tree, prefix, level, Optional.ofNullable(parentPrefix));
    }

    /**
     * @param parentPrefix when present, the immediate parent's text must start with it; lines without a
     *                     parent never match such a filter
     */
    public List<ConfLine> search(ConfTree tree, String prefix, int level, Optional<String> parentPrefix) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(parentPrefix, "parentPrefix");

        List<ConfLine> matches = new ArrayList<>();
        for (ConfLine line : tree.lines()) {
            if (line.level() != level) {
                continue;
            }
            if (!line.text().startsWith(prefix)) {
                continue;
            }
            if (parentPrefix.isPresent() && !parentStartsWith(line, parentPrefix.get())) {
                continue;
            }
            matches.add(line);
        }
        return matches;
    }

    private boolean parentStartsWith(ConfLine line, String parentPrefix) {
        return line.parent()
                .map(parent -> parent.text().startsWith(parentPrefix))
                .orElse(false);
    }
}
