package com.shelf.matching.stats;

/**
 * Bucket an item completion is counted in.
 */
public enum RunOutcome {
    SUCCESS,
    NO_MATCH,
    ERROR
}
