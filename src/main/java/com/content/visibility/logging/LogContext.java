package com.content.visibility.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forRecompute(correlationId, userId)) {
 *     log.info("recompute.completed userId={} excluded={}", userId, excluded);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a single-user recompute.
     */
    public static LogContext forRecompute(String correlationId, long userId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("userId", Long.toString(userId));
        ctx.put("operation", "recompute");
        return ctx;
    }

    /**
     * Creates a log context for an all-user recompute.
     */
    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "recompute-all");
        return ctx;
    }

    /**
     * Creates a log context for hide and unhide actions.
     */
    public static LogContext forHide(long userId, String entityType) {
        LogContext ctx = new LogContext();
        ctx.put("userId", Long.toString(userId));
        ctx.put("entityType", entityType);
        ctx.put("operation", "hide");
        return ctx;
    }

    public static String generateCorrelationId() {
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
