package com.shelf.matching.core.model;

import java.util.Locale;

/**
 * Three-tier classification of one catalog candidate against a shelf item.
 */
public enum MatchStatus {
    IDENTICAL,
    ALMOST_SAME,
    NOT_MATCH;

    /**
     * Parses a wire value such as {@code "almost_same"} or {@code "ALMOST-SAME"}.
     *
     * @throws IllegalArgumentException if the value is not a known status
     */
    public static MatchStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Match status is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return MatchStatus.valueOf(normalized);
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
