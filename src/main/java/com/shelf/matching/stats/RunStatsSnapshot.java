package com.shelf.matching.stats;

/**
 * Point-in-time view of cumulative run counters.
 * {@code processed} always equals {@code success + noMatch + errors}.
 *
 * @param total     items in the run
 * @param processed items that reached a terminal result
 * @param success   items auto-saved
 * @param noMatch   items without an automatic match, including those sent to manual review
 * @param errors    items that failed
 */
public record RunStatsSnapshot(int total, long processed, long success, long noMatch, long errors) {

    public RunStatsSnapshot {
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0");
        }
        if (processed != success + noMatch + errors) {
            throw new IllegalArgumentException("processed must equal success + noMatch + errors");
        }
    }

    public static RunStatsSnapshot empty(int total) {
        return new RunStatsSnapshot(total, 0, 0, 0, 0);
    }

    public long remaining() {
        return Math.max(0, total - processed);
    }

    /**
     * Returns a new snapshot with one more completion in the given bucket.
     */
    public RunStatsSnapshot plus(RunOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> new RunStatsSnapshot(total, processed + 1, success + 1, noMatch, errors);
            case NO_MATCH -> new RunStatsSnapshot(total, processed + 1, success, noMatch + 1, errors);
            case ERROR -> new RunStatsSnapshot(total, processed + 1, success, noMatch, errors + 1);
        };
    }
}
