package io.netconf.confdiff.compare;

import io.netconf.confdiff.tree.ConfLine;
import java.util.List;

/**
 * Outcome of comparing a reference configuration with a compared one.
 *
 * <p>{@code modifiedChildren} is a flat list: entries produced for nested parents come before the entry
 * of the parent they were found under.
 */
public record ComparisonResult(List<ConfLine> deletedRoots,
                               List<ConfLine> addedRoots,
                               List<LinePair> modifiedRoots,
                               List<ChildrenDiff> modifiedChildren) {

    public ComparisonResult {
        deletedRoots = deletedRoots == null ? List.of() : List.copyOf(deletedRoots);
        addedRoots = addedRoots == null ? List.of() : List.copyOf(addedRoots);
        modifiedRoots = modifiedRoots == null ? List.of() : List.copyOf(modifiedRoots);
        modifiedChildren = modifiedChildren == null ? List.of() : List.copyOf(modifiedChildren);
    }

    public static ComparisonResult empty() {
        return new ComparisonResult(List.of(), List.of(), List.of(), List.of());
    }

    public boolean hasDifferences() {
        return !deletedRoots.isEmpty()
                || !addedRoots.isEmpty()
                || !modifiedRoots.isEmpty()
                || !modifiedChildren.isEmpty();
    }
}
