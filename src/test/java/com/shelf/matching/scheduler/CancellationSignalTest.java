package com.shelf.matching.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CancellationSignal Tests")
class CancellationSignalTest {

    @Test
    @DisplayName("Hooks run once when the signal fires")
    void hooksRunOnce() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);

        assertTrue(signal.cancel());
        assertFalse(signal.cancel());
        assertEquals(1, calls.get());
        assertTrue(signal.isCancelled());
    }

    @Test
    @DisplayName("Hook registered after firing runs immediately")
    void lateHook() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        AtomicInteger calls = new AtomicInteger();

        signal.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Failing hook does not stop the others")
    void failingHook() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(() -> {
            throw new IllegalStateException("hook failed");
        });
        signal.onCancel(calls::incrementAndGet);

        signal.cancel();

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("throwIfCancelled and stage reporting follow the signal")
    void contextFollowsSignal() {
        AtomicInteger stages = new AtomicInteger();
        CancellationSignal signal = new CancellationSignal();
        ItemContext context = new ItemContext("run", "item", signal, stage -> stages.incrementAndGet());

        assertDoesNotThrow(context::checkCancelled);
        context.reportStage("searching");
        signal.cancel();
        context.reportStage("classifying");

        assertEquals(1, stages.get());
        assertThrows(CancellationException.class, context::checkCancelled);
    }

    @Test
    @DisplayName("Commit and cancel are mutually exclusive")
    void commitExcludesCancel() {
        CancellationSignal committed = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        committed.onCancel(calls::incrementAndGet);

        assertTrue(committed.commit());
        assertFalse(committed.cancel());
        assertFalse(committed.isCancelled());
        assertEquals(0, calls.get());

        CancellationSignal cancelled = new CancellationSignal();
        cancelled.cancel();
        assertFalse(cancelled.commit());
        assertFalse(cancelled.isCommitted());
    }

    @Test
    @DisplayName("Context commit fails once the execution was cancelled")
    void contextCommit() {
        CancellationSignal signal = new CancellationSignal();
        ItemContext context = new ItemContext("run", "item", signal, null);
        context.commit();
        assertTrue(signal.isCommitted());

        CancellationSignal late = new CancellationSignal();
        late.cancel();
        assertThrows(CancellationException.class,
                () -> new ItemContext("run", "item", late, null).commit());
    }
}
