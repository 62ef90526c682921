package io.netconf.confdiff.compare;

import static org.assertj.core.api.Assertions.assertThat;

import io.netconf.confdiff.tree.ConfLine;
import io.netconf.confdiff.tree.ConfParser;
import java.util.List;
import org.junit.jupiter.api.Test;

class StartMatcherTest {

    private final ConfParser parser = new ConfParser();

    @Test
    void pairsEachReferenceLineWithFirstFreeCandidate() {
        List<ConfLine> reference = roots("interface A", "interface B", "hostname x");
        List<ConfLine> compared = roots("hostname y", "interface B");

        StartMatcher.Matching matching = StartMatcher.match(reference, compared, false);

        assertThat(matching.pairs()).extracting(pair -> pair.reference().text() + "|" + pair.compared().text())
                .containsExactly("interface A|interface B", "hostname x|hostname y");
        assertThat(matching.unmatchedReference()).extracting(ConfLine::text).containsExactly("interface B");
        assertThat(matching.unmatchedCompared()).isEmpty();
    }

    @Test
    void matchesWholeFirstTokenOnly() {
        StartMatcher.Matching matching = StartMatcher.match(roots("ip route 0.0.0.0"), roots("ipv6 route ::/0"), false);

        assertThat(matching.pairs()).isEmpty();
        assertThat(matching.unmatchedReference()).hasSize(1);
        assertThat(matching.unmatchedCompared()).hasSize(1);
    }

    @Test
    void sameLevelRequirementRejectsCandidatesAtOtherLevels() {
        ConfLine levelOne = parser.parse("a\n b x\n").line(1);
        ConfLine levelTwo = parser.parse("a\n b y\n  b z\n").line(2);

        StartMatcher.Matching strict = StartMatcher.match(List.of(levelOne), List.of(levelTwo), true);
        StartMatcher.Matching lenient = StartMatcher.match(List.of(levelOne), List.of(levelTwo), false);

        assertThat(strict.pairs()).isEmpty();
        assertThat(strict.unmatchedCompared()).containsExactly(levelTwo);
        assertThat(lenient.pairs()).hasSize(1);
    }

    private List<ConfLine> roots(String... lines) {
        return parser.parse(String.join("\n", lines)).roots();
    }
}
