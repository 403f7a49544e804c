package com.shelf.matching.tracing;

/**
 * Trace span of a batch run or of one item's pipeline. Closing it ends the span.
 *
 * <pre>
 * try (Span span = tracingService.startItemSpan(runId, itemId)) {
 *     span.addEvent("searching");
 *     span.setAttribute("outcome", "auto_saved");
 *     span.succeed();
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    /**
     * Timestamped marker inside the span, used for pipeline stage transitions.
     */
    void addEvent(String name);

    void succeed();

    void fail(Throwable cause);

    @Override
    void close();
}
