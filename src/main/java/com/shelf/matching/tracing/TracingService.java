package com.shelf.matching.tracing;

/**
 * Tracing seam of the matcher. {@link NoOpTracingService} is the default, so the
 * library runs without any tracing dependency on the classpath.
 */
public interface TracingService {

    String RUN_SPAN = "shelf.batch";
    String ITEM_SPAN = "shelf.match";

    /**
     * Starts the span covering a whole batch run.
     */
    Span startRunSpan(String runId, int totalItems);

    /**
     * Starts the span covering one item's pipeline.
     *
     * @param runId run the item belongs to, or null for a standalone match
     */
    Span startItemSpan(String runId, String itemId);
}
