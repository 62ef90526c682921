package io.netconf.confdiff.compare;

import io.netconf.confdiff.tree.ConfLine;
import java.util.Objects;

/**
 * A reference line and the compared line it was paired with.
 */
public record LinePair(ConfLine reference, ConfLine compared) {

    public LinePair {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(compared, "compared");
    }

    /** Full token-sequence equality. */
    public boolean isExactMatch() {
        return reference.content().equals(compared.content());
    }
}
