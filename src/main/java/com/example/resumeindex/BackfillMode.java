package com.example.resumeindex;

import java.util.Locale;

public enum BackfillMode {
    /** Every row, re-embedded into a fresh artifact. */
    FULL,
    /** Only rows that have never been attached to an artifact. */
    MISSING;

    public static BackfillMode parse(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "full":
                return FULL;
            case "missing":
                return MISSING;
            default:
                throw new ConfigurationException("mode must be either 'full' or 'missing', got '" + value + "'.");
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
