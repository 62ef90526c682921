package io.netconf.confdiff.compare;

import io.netconf.confdiff.tree.ConfLine;
import io.netconf.confdiff.tree.ConfTree;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes a structural diff between a reference configuration and a compared configuration.
 *
 * <p>Root lines and, below every matched pair, direct children are paired by first token using
 * {@link StartMatcher}. The ignore pattern is applied to the flat line lists before roots are taken;
 * children lists are walked as parsed. A paired child whose content differs is reported as modified and its own children
 * are not examined; only identical pairs are descended into. Root pairs are always descended into, even
 * when their content differs.
 */
public class ConfComparator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfComparator.class);

    public ComparisonResult compare(ConfTree reference, ConfTree compared) {
        return compare(reference, compared, "");
    }

    /**
     * @param ignorePattern regular expression searched in each line's text; matching lines are dropped from
     *                      both flat line lists, so an ignored line never takes part as a root. Empty or
     *                      malformed patterns leave every line in.
     */
    public ComparisonResult compare(ConfTree reference, ConfTree compared, String ignorePattern) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(compared, "compared");
        IgnoreFilter filter = IgnoreFilter.compile(ignorePattern);

        List<ConfLine> referenceRoots = rootsOf(filter.retain(reference.lines()));
        List<ConfLine> comparedRoots = rootsOf(filter.retain(compared.lines()));
        StartMatcher.Matching rootMatching = StartMatcher.match(referenceRoots, comparedRoots, false);

        List<LinePair> modifiedRoots = new ArrayList<>();
        List<ChildrenDiff> modifiedChildren = new ArrayList<>();
        for (LinePair rootPair : rootMatching.pairs()) {
            if (!rootPair.isExactMatch()) {
                modifiedRoots.add(rootPair);
            }
            compareDescendants(rootPair, modifiedChildren);
        }

        ComparisonResult result = new ComparisonResult(
                rootMatching.unmatchedReference(),
                rootMatching.unmatchedCompared(),
                modifiedRoots,
                modifiedChildren);
        LOGGER.debug("Compared {} reference roots with {} compared roots: {} paired, {} deleted, {} added, {} modified, {} child diffs",
                referenceRoots.size(), comparedRoots.size(), rootMatching.pairs().size(),
                result.deletedRoots().size(), result.addedRoots().size(),
                result.modifiedRoots().size(), result.modifiedChildren().size());
        return result;
    }

    /**
     * Depth-first walk below a matched root pair. A frame stays on the stack until all of its identical child
     * pairs have been walked, so nested entries are emitted before their parent's entry.
     */
    private void compareDescendants(LinePair rootPair, List<ChildrenDiff> sink) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(rootPair));
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.hasNextPair()) {
                LinePair pair = frame.nextPair();
                if (!pair.isExactMatch()) {
                    frame.modified.add(pair);
                } else if (pair.reference().hasChildren() || pair.compared().hasChildren()) {
                    stack.push(new Frame(pair));
                }
                continue;
            }
            stack.pop();
            ChildrenDiff diff = frame.toDiff();
            if (!diff.isEmpty()) {
                sink.add(diff);
            }
        }
    }

    private static List<ConfLine> rootsOf(List<ConfLine> lines) {
        return lines.stream().filter(ConfLine::isRoot).toList();
    }

    private static final class Frame {

        private final ConfLine parent;
        private final StartMatcher.Matching matching;
        private final List<LinePair> modified = new ArrayList<>();
        private int cursor;

        private Frame(LinePair parentPair) {
            this.parent = parentPair.reference();
            this.matching = StartMatcher.match(
                    parentPair.reference().children(),
                    parentPair.compared().children(),
                    true);
        }

        private boolean hasNextPair() {
            return cursor < matching.pairs().size();
        }

        private LinePair nextPair() {
            return matching.pairs().get(cursor++);
        }

        private ChildrenDiff toDiff() {
            return new ChildrenDiff(parent, matching.unmatchedCompared(), matching.unmatchedReference(), modified);
        }
    }
}
