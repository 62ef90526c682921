package io.netconf.confdiff.tree;

import java.util.List;
import java.util.Objects;

/**
 * A retained source line with its raw indentation width and whitespace-split tokens.
 */
public record IndentedLine(int lineNumber, int rawIndent, List<String> tokens) {

    public IndentedLine {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be 1-based");
        }
        if (rawIndent < 0) {
            throw new IllegalArgumentException("rawIndent must not be negative");
        }
        tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("tokens must not be empty");
        }
    }
}
