package com.careinsight.careinsight.imports;

import java.util.Locale;

/**
 * Commit strategy: replace all destination rows, or add to them.
 */
public enum ImportMode {

    OVERWRITE(ImportConstants.MODE_OVERWRITE),
    APPEND(ImportConstants.MODE_APPEND);

    private final String value;

    ImportMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses a client-supplied mode, ignoring case and surrounding whitespace.
     *
     * @throws InvalidModeException when the value is not a recognized mode
     */
    public static ImportMode fromValue(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (ImportMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new InvalidModeException(raw);
    }
}
