package com.shelf.matching.progress;

/**
 * Receives the progress stream of a batch run.
 *
 * <p>Events of one run are delivered one at a time from the run's coordinator
 * thread, in completion order. Listeners should return quickly; a listener that
 * throws is logged and skipped, it does not affect the run.</p>
 */
@FunctionalInterface
public interface ProgressListener {

    void onEvent(ProgressEvent event);

    static ProgressListener noOp() {
        return event -> { };
    }

    /**
     * Returns a listener that forwards to this one, then to {@code next}.
     */
    default ProgressListener andThen(ProgressListener next) {
        return event -> {
            onEvent(event);
            next.onEvent(event);
        };
    }
}
