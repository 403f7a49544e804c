package com.shelf.matching.stats;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cumulative counters of one batch run.
 *
 * <p>All counters move together in a single atomic swap, so any reader sees a
 * consistent {@link RunStatsSnapshot} and {@code processed} never decreases.
 * Safe to update and read from any thread.</p>
 */
public class PipelineRunStats {

    private final AtomicReference<RunStatsSnapshot> current;

    public PipelineRunStats(int total) {
        this.current = new AtomicReference<>(RunStatsSnapshot.empty(total));
    }

    /**
     * Counts one completed item and returns the counters including it.
     */
    public RunStatsSnapshot record(RunOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome is required");
        return current.updateAndGet(s -> s.plus(outcome));
    }

    public RunStatsSnapshot snapshot() {
        return current.get();
    }
}
