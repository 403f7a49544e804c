package com.shelf.matching.core.model;

/**
 * Helpers for unit-interval scores.
 */
public final class Scores {

    private Scores() {
    }

    /**
     * Clamps a score into [0, 1]. NaN becomes 0.
     */
    public static double clamp(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(value, 1.0);
    }
}
