package com.shelf.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Entries are added on creation and removed on close:
 *
 * <pre>
 * try (LogContext ctx = LogContext.forItem(runId, item.id())) {
 *     log.info("item.matched outcome={}", decision.outcome());
 * }
 * </pre>
 *
 * <p>MDC is thread-local; a context opened on the coordinator thread is not
 * visible on worker threads, which open their own.</p>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String ITEM_ID = "itemId";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for the coordinator of one batch run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, runId);
        ctx.put(OPERATION, "batch");
        return ctx;
    }

    /**
     * Context for the pipeline of one item.
     */
    public static LogContext forItem(String runId, String itemId) {
        LogContext ctx = new LogContext();
        if (runId != null) {
            ctx.put(RUN_ID, runId);
        }
        ctx.put(ITEM_ID, itemId);
        ctx.put(OPERATION, "match");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
