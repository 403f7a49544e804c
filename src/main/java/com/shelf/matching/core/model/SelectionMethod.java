package com.shelf.matching.core.model;

import java.util.Locale;

/**
 * How an auto-saved candidate was chosen.
 */
public enum SelectionMethod {
    /** At least one candidate was classified identical; the best-ranked one won. */
    AUTO_SELECT,

    /** Exactly one candidate was classified almost_same. */
    CONSOLIDATION,

    /** Several almost_same candidates; one won on visual similarity. */
    VISUAL_MATCHING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
