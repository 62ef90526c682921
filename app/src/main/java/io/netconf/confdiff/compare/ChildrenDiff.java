package io.netconf.confdiff.compare;

import io.netconf.confdiff.tree.ConfLine;
import java.util.List;
import java.util.Objects;

/**
 * Differences among the direct children of one matched parent pair.
 *
 * @param parent the parent line from the reference configuration
 * @param addedChildren children only present under the compared parent, each with its subtree
 * @param deletedChildren children only present under the reference parent, each with its subtree
 * @param modifiedChildren paired children whose content differs
 */
public record ChildrenDiff(ConfLine parent,
                           List<ConfLine> addedChildren,
                           List<ConfLine> deletedChildren,
                           List<LinePair> modifiedChildren) {

    public ChildrenDiff {
        Objects.requireNonNull(parent, "parent");
        addedChildren = addedChildren == null ? List.of() : List.copyOf(addedChildren);
        deletedChildren = deletedChildren == null ? List.of() : List.copyOf(deletedChildren);
        modifiedChildren = modifiedChildren == null ? List.of() : List.copyOf(modifiedChildren);
    }

    public boolean isEmpty() {
        return addedChildren.isEmpty() && deletedChildren.isEmpty() && modifiedChildren.isEmpty();
    }
}
