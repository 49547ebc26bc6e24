package org.apiwatch.monitoring;

import java.util.Locale;

public enum RetrievalMode {
    SUMMARY,
    DETAILS,
    FULL;

    /** A missing mode means {@link #SUMMARY}. */
    public static RetrievalMode parse(String value) {
        if (value == null || value.isBlank()) return SUMMARY;
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Unknown mode '" + value + "'; expected summary, details or full");
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
