package com.shelf.matching.scheduler;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Per-execution handle given to an {@link ItemProcessor}. Carries the cancellation
 * signal and forwards stage transitions to the run's progress stream.
 */
public final class ItemContext {

    private final String runId;
    private final String itemId;
    private final CancellationSignal signal;
    private final Consumer<String> stageSink;

    public ItemContext(String runId, String itemId, CancellationSignal signal, Consumer<String> stageSink) {
        this.runId = runId;
        this.itemId = Objects.requireNonNull(itemId, "itemId is required");
        this.signal = Objects.requireNonNull(signal, "signal is required");
        this.stageSink = stageSink != null ? stageSink : stage -> { };
    }

    /**
     * Context for an item processed outside a batch run.
     */
    public static ItemContext standalone(String itemId) {
        return new ItemContext(null, itemId, new CancellationSignal(), null);
    }

    /**
     * Run id, or null for a standalone execution.
     */
    public String runId() {
        return runId;
    }

    public String itemId() {
        return itemId;
    }

    public CancellationSignal signal() {
        return signal;
    }

    /**
     * Reports that the item entered a new stage. Ignored once the execution was cancelled.
     */
    public void reportStage(String stage) {
        if (!signal.isCancelled()) {
            stageSink.accept(stage);
        }
    }

    /**
     * Commits the execution to its result. Once committed the execution is no longer
     * subject to its timeout.
     *
     * @throws java.util.concurrent.CancellationException if the execution was cancelled first
     */
    public void commit() {
        if (!signal.commit()) {
            signal.throwIfCancelled();
        }
    }

    /**
     * @throws java.util.concurrent.CancellationException if the execution was cancelled
     */
    public void checkCancelled() {
        signal.throwIfCancelled();
    }
}
