package com.shelf.matching.progress;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.shelf.matching.stats.RunStatsSnapshot;

import java.util.Objects;

/**
 * One entry of the progress stream of a batch run.
 *
 * <p>Counters are cumulative for the run at the moment the event was emitted.
 * Item-level events carry {@code currentItemId} and {@code stage}; run-level
 * events leave them null.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressEvent(
        ProgressEventType type,
        String runId,
        long processed,
        int total,
        long cumulativeSuccess,
        long cumulativeNoMatch,
        long cumulativeErrors,
        String currentItemId,
        String stage,
        String message,
        Long elapsedMillis
) {
    public ProgressEvent {
        Objects.requireNonNull(type, "type is required");
    }

    public static ProgressEvent start(String runId, RunStatsSnapshot stats) {
        return of(ProgressEventType.START, runId, stats, null, null,
                "Processing " + stats.total() + " items", null);
    }

    /**
     * An item moved to a new pipeline stage.
     */
    public static ProgressEvent stage(String runId, RunStatsSnapshot stats, String itemId, String stage) {
        return of(ProgressEventType.PROGRESS, runId, stats, itemId, stage, null, null);
    }

    /**
     * An item reached its terminal result; {@code stats} already includes it.
     */
    public static ProgressEvent itemCompleted(String runId, RunStatsSnapshot stats, String itemId,
                                              String stage, String message) {
        return of(ProgressEventType.PROGRESS, runId, stats, itemId, stage, message, null);
    }

    public static ProgressEvent complete(String runId, RunStatsSnapshot stats, long elapsedMillis, boolean stopped) {
        String message = stopped
                ? "Stopped after " + stats.processed() + " of " + stats.total() + " items"
                : "Processed " + stats.processed() + " items";
        return of(ProgressEventType.COMPLETE, runId, stats, null, null, message, elapsedMillis);
    }

    public static ProgressEvent error(String runId, RunStatsSnapshot stats, String message, long elapsedMillis) {
        return of(ProgressEventType.ERROR, runId, stats, null, null, message, elapsedMillis);
    }

    private static ProgressEvent of(ProgressEventType type, String runId, RunStatsSnapshot stats,
                                    String itemId, String stage, String message, Long elapsedMillis) {
        return new ProgressEvent(type, runId, stats.processed(), stats.total(),
                stats.success(), stats.noMatch(), stats.errors(), itemId, stage, message, elapsedMillis);
    }
}
