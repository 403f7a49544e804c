package com.shelf.matching.core.model;

/**
 * Classifies why an item resolved to {@link MatchOutcome#ERROR}.
 */
public enum FailureKind {
    /** The catalog search failed or timed out. */
    RETRIEVAL,

    /** The classification service failed or was cancelled. */
    CLASSIFICATION,

    /** The detection item was malformed (e.g. no reference image). */
    VALIDATION,

    /** The item exceeded its individual time budget. */
    TIMEOUT,

    /** A broken concurrency guarantee; fatal for the whole run. */
    SCHEDULER,

    /** Any other unexpected failure, including persistence errors. */
    INTERNAL
}
