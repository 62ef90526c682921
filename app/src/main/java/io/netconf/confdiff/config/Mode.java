package io.netconf.confdiff.config;

/**
 * What the command line run does with the given configuration files.
 */
public enum Mode {
    COMPARE,
    SEARCH;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return COMPARE;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public boolean isSearch() {
        return this == SEARCH;
    }
}
