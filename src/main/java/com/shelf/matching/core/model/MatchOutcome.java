package com.shelf.matching.core.model;

import java.util.Locale;

/**
 * Terminal outcome of matching one detection item.
 */
public enum MatchOutcome {
    /** A single catalog candidate was selected automatically. */
    AUTO_SAVED,

    /** Several plausible candidates remain; a human has to pick one. */
    NEEDS_MANUAL_REVIEW,

    /** No candidate survived filtering and classification. */
    NO_MATCH,

    /** The item could not be processed. */
    ERROR;

    /**
     * Returns the lower-case wire name (e.g. {@code auto_saved}).
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
