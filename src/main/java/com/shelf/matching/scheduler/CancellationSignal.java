package com.shelf.matching.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative abort flag handed to one item execution.
 *
 * <p>The scheduler fires it when the item times out; external calls poll
 * {@link #isCancelled()} or register an {@link #onCancel(Runnable)} hook to abort
 * in-flight requests. Firing is idempotent and hooks run at most once.</p>
 *
 * <p>An execution that is about to publish its result {@link #commit() commits}; from
 * then on the signal can no longer fire. Exactly one of commit and cancel succeeds.</p>
 */
public final class CancellationSignal {
    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> hooks = new ArrayList<>();
    private boolean committed;

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Fires the signal. Returns false if it had already fired or the execution committed.
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (hooks) {
            if (committed || !cancelled.compareAndSet(false, true)) {
                return false;
            }
            toRun = new ArrayList<>(hooks);
            hooks.clear();
        }
        for (Runnable hook : toRun) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation hook failed: {}", e.getMessage(), e);
            }
        }
        return true;
    }

    /**
     * Marks the execution as past the point of no return. Returns false if the signal
     * already fired, in which case the caller must not publish its result.
     */
    public boolean commit() {
        synchronized (hooks) {
            if (cancelled.get()) {
                return false;
            }
            committed = true;
            hooks.clear();
            return true;
        }
    }

    public boolean isCommitted() {
        synchronized (hooks) {
            return committed;
        }
    }

    /**
     * Registers a hook to run on cancellation. Runs immediately if the signal already fired.
     */
    public void onCancel(Runnable hook) {
        synchronized (hooks) {
            if (!isCancelled()) {
                hooks.add(hook);
                return;
            }
        }
        hook.run();
    }

    /**
     * @throws CancellationException if the signal has fired
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Execution was cancelled");
        }
    }
}
