package io.netconf.confdiff.tree;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, read-only collection of all lines produced by a single parse.
 */
public final class ConfTree {

    private final List<ConfLine> lines;

    ConfTree(List<ConfLine> arena) {
        this.lines = Collections.unmodifiableList(Objects.requireNonNull(arena, "arena"));
    }

    public static ConfTree empty() {
        return new ConfTree(List.of());
    }

    public List<ConfLine> lines() {
        return lines;
    }

    /** Lines at level 0, in document order. Orphaned lines are never included. */
    public List<ConfLine> roots() {
        return lines.stream().filter(ConfLine::isRoot).toList();
    }

    public ConfLine line(int index) {
        return lines.get(index);
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    @Override
    public String toString() {
        return "Configuration with " + lines.size() + " lines";
    }
}
