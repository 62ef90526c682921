package io.netconf.confdiff.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns levels to analyzed lines and links each line to its nearest preceding line one level up.
 *
 * <p>Levels come straight from {@code rawIndent / unit} for every line. Irregular indentation therefore
 * yields levels that skip steps, and a line whose {@code level - 1} never occurred before it stays
 * without a parent.
 */
public class TreeBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(TreeBuilder.class);

    public ConfTree build(IndentationProfile profile) {
        Objects.requireNonNull(profile, "profile");

        List<ConfLine> arena = new ArrayList<>(profile.lines().size());
        for (IndentedLine line : profile.lines()) {
            arena.add(new ConfLine(arena, arena.size(), line.lineNumber(), profile.levelOf(line), line.tokens()));
        }

        int orphans = 0;
        for (ConfLine current : arena) {
            if (current.level() == 0) {
                continue;
            }
            ConfLine parent = findParent(arena, current);
            if (parent != null) {
                current.attachTo(parent);
            } else {
                orphans++;
                LOGGER.debug("No line at level {} precedes {}", current.level() - 1, current.describe());
            }
        }
        if (orphans > 0) {
            LOGGER.debug("{} line(s) have no line at the preceding level and remain unattached", orphans);
        }
        return new ConfTree(arena);
    }

    private ConfLine findParent(List<ConfLine> arena, ConfLine current) {
        int wanted = current.level() - 1;
        for (int i = current.index() - 1; i >= 0; i--) {
            ConfLine candidate = arena.get(i);
            if (candidate.level() == wanted) {
                return candidate;
            }
        }
        return null;
    }
}
