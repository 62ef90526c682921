package io.netconf.confdiff.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Criteria for a search run: a text prefix, the exact level, and an optional prefix for the parent line.
 */
public record SearchSettings(String prefix, int level, Optional<String> parentPrefix) {

    public SearchSettings {
        prefix = Objects.requireNonNullElse(prefix, "");
        if (level < 0) {
            throw new IllegalArgumentException("level must be zero or greater");
        }
        parentPrefix = parentPrefix == null ? Optional.empty() : parentPrefix;
    }

    public static SearchSettings defaults() {
        return new SearchSettings("", 0, Optional.empty());
    }
}
