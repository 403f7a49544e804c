package com.shelf.matching.scheduler;

import com.shelf.matching.stats.PipelineRunStats;
import com.shelf.matching.stats.RunStatsSnapshot;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle to a batch run in progress.
 *
 * <p>{@link #stop()} halts admissions; executions already in flight finish and
 * are reported, then the run completes with {@code stopped = true}.</p>
 */
public final class BatchRun<R> {

    private final String runId;
    private final PipelineRunStats stats;
    private final CompletableFuture<BatchRunResult<R>> completion = new CompletableFuture<>();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch stopLatch = new CountDownLatch(1);

    BatchRun(String runId, PipelineRunStats stats) {
        this.runId = runId;
        this.stats = stats;
    }

    public String runId() {
        return runId;
    }

    /**
     * Requests the run to stop admitting new items. Idempotent.
     */
    public void stop() {
        if (stopRequested.compareAndSet(false, true)) {
            stopLatch.countDown();
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public RunStatsSnapshot currentStats() {
        return stats.snapshot();
    }

    public CompletableFuture<BatchRunResult<R>> completion() {
        return completion;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Blocks until the run finishes.
     *
     * @throws SchedulerInvariantException if the run aborted on a broken concurrency guarantee
     * @throws CancellationException       if the scheduler was shut down under the run
     */
    public BatchRunResult<R> await() {
        try {
            return completion.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }

    CountDownLatch stopLatch() {
        return stopLatch;
    }

    PipelineRunStats stats() {
        return stats;
    }
}
