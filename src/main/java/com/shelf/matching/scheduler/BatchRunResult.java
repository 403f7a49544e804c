package com.shelf.matching.scheduler;

import com.shelf.matching.stats.RunStatsSnapshot;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of a finished batch run.
 *
 * @param runId       run identifier
 * @param results     terminal result of every admitted item, in completion order
 * @param stats       final counters
 * @param elapsed     wall time of the run
 * @param stopped     whether the run was stopped before all items were admitted
 * @param notAdmitted items never admitted because of the stop
 */
public record BatchRunResult<R>(
        String runId,
        List<R> results,
        RunStatsSnapshot stats,
        Duration elapsed,
        boolean stopped,
        int notAdmitted
) {
    public BatchRunResult {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(stats, "stats is required");
        Objects.requireNonNull(elapsed, "elapsed is required");
        results = List.copyOf(results);
    }

    public int size() {
        return results.size();
    }
}
