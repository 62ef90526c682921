package io.netconf.confdiff.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single non-blank configuration line and its position in the parsed hierarchy.
 *
 * <p>Lines are stored in the arena owned by their {@link ConfTree}; the parent and the children are
 * kept as arena indices and resolved on access. Links are only established while the tree is built.
 */
public final class ConfLine {

    static final int NO_PARENT = -1;

    private final List<ConfLine> arena;
    private final int index;
    private final int lineNumber;
    private final int level;
    private final List<String> content;
    private final List<Integer> childIndexes = new ArrayList<>();
    private int parentIndex = NO_PARENT;

    ConfLine(List<ConfLine> arena, int index, int lineNumber, int level, List<String> content) {
        this.arena = Objects.requireNonNull(arena, "arena");
        this.index = index;
        this.lineNumber = lineNumber;
        this.level = level;
        this.content = List.copyOf(Objects.requireNonNull(content, "content"));
    }

    void attachTo(ConfLine parent) {
        if (parent.arena != arena) {
            throw new IllegalArgumentException("parent belongs to a different tree");
        }
        parentIndex = parent.index;
        parent.childIndexes.add(index);
    }

    /** Position of this line within {@link ConfTree#lines()}. */
    public int index() {
        return index;
    }

    /** 1-based line number in the source text, blank lines included. */
    public int lineNumber() {
        return lineNumber;
    }

    public int level() {
        return level;
    }

    public List<String> content() {
        return content;
    }

    public String firstToken() {
        return content.get(0);
    }

    /** Tokens joined with single spaces. */
    public String text() {
        return String.join(" ", content);
    }

    public Optional<ConfLine> parent() {
        return parentIndex == NO_PARENT ? Optional.empty() : Optional.of(arena.get(parentIndex));
    }

    public List<ConfLine> children() {
        if (childIndexes.isEmpty()) {
            return List.of();
        }
        List<ConfLine> children = new ArrayList<>(childIndexes.size());
        for (int childIndex : childIndexes) {
            children.add(arena.get(childIndex));
        }
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !childIndexes.isEmpty();
    }

    public boolean hasParent() {
        return parentIndex != NO_PARENT;
    }

    /** A line that is neither attached to a parent nor carries children. */
    public boolean isLoneLine() {
        return !hasParent() && !hasChildren();
    }

    public boolean isRoot() {
        return level == 0;
    }

    /** A non-root line for which no preceding line one level up exists. */
    public boolean isOrphan() {
        return level > 0 && !hasParent();
    }

    public List<ConfLine> siblings() {
        return parent()
                .map(p -> p.children().stream().filter(child -> child != this).toList())
                .orElse(List.of());
    }

    public int directChildrenCount() {
        return childIndexes.size();
    }

    public int allChildrenCount() {
        return descendants().size();
    }

    public List<List<String>> directChildren() {
        return children().stream().map(ConfLine::content).toList();
    }

    public List<List<String>> allChildren() {
        return descendants().stream().map(ConfLine::content).toList();
    }

    /**
     * All lines below this one in depth-first pre-order, which is also document order.
     */
    public List<ConfLine> descendants() {
        List<ConfLine> result = new ArrayList<>();
        Deque<ConfLine> pending = new ArrayDeque<>();
        pushChildren(pending, this);
        while (!pending.isEmpty()) {
            ConfLine next = pending.pop();
            result.add(next);
            pushChildren(pending, next);
        }
        return result;
    }

    /** This line followed by its descendants. */
    public List<ConfLine> subtree() {
        List<ConfLine> result = new ArrayList<>();
        result.add(this);
        result.addAll(descendants());
        return result;
    }

    /**
     * Ancestor chain and this line, outermost first, joined with {@code " > "}.
     */
    public String path() {
        Deque<String> parts = new ArrayDeque<>();
        parts.push(text());
        Optional<ConfLine> current = parent();
        while (current.isPresent()) {
            parts.push(current.get().text());
            current = current.get().parent();
        }
        return String.join(" > ", parts);
    }

    private static void pushChildren(Deque<ConfLine> pending, ConfLine line) {
        List<ConfLine> children = line.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            pending.push(children.get(i));
        }
    }

    @Override
    public String toString() {
        return text();
    }

    public String describe() {
        return "ConfLine(lineNumber=" + lineNumber + ", level=" + level + ", content=" + content + ")";
    }
}
