package io.netconf.confdiff.compare;

import io.netconf.confdiff.tree.ConfLine;
import java.util.ArrayList;
import java.util.List;

/**
 * Greedy pairing of two sibling lists by first token.
 *
 * <p>Each reference line, in order, takes the first compared line that is still free and starts with the
 * same token. The result depends on document order and is not a minimal alignment; duplicate leading
 * tokens are paired strictly in the order they appear.
 */
final class StartMatcher {

    private StartMatcher() {
    }

    static Matching match(List<ConfLine> reference, List<ConfLine> compared, boolean requireSameLevel) {
        boolean[] referenceMatched = new boolean[reference.size()];
        boolean[] comparedMatched = new boolean[compared.size()];
        List<LinePair> pairs = new ArrayList<>();

        for (int r = 0; r < reference.size(); r++) {
            ConfLine referenceLine = reference.get(r);
            for (int c = 0; c < compared.size(); c++) {
                if (comparedMatched[c]) {
                    continue;
                }
                ConfLine comparedLine = compared.get(c);
                if (requireSameLevel && referenceLine.level() != comparedLine.level()) {
                    continue;
                }
                if (referenceLine.firstToken().equals(comparedLine.firstToken())) {
                    referenceMatched[r] = true;
                    comparedMatched[c] = true;
                    pairs.add(new LinePair(referenceLine, comparedLine));
                    break;
                }
            }
        }

        return new Matching(pairs,
                unmatched(reference, referenceMatched),
                unmatched(compared, comparedMatched));
    }

    private static List<ConfLine> unmatched(List<ConfLine> lines, boolean[] matched) {
        List<ConfLine> result = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            if (!matched[i]) {
                result.add(lines.get(i));
            }
        }
        return result;
    }

    record Matching(List<LinePair> pairs, List<ConfLine> unmatchedReference, List<ConfLine> unmatchedCompared) {
    }
}
