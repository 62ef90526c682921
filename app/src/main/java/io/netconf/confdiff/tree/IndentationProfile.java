package io.netconf.confdiff.tree;

import java.util.List;
import java.util.Objects;

/**
 * Retained lines of one document together with the indentation unit inferred across all of them.
 */
public record IndentationProfile(List<IndentedLine> lines, int unit) {

    public IndentationProfile {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        if (unit < 1) {
            throw new IllegalArgumentException("unit must be at least 1");
        }
    }

    public int levelOf(IndentedLine line) {
        return line.rawIndent() / unit;
    }
}
