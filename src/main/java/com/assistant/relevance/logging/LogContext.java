package com.assistant.relevance.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRoute(correlationId)) {
 *     log.info("router.decision handler={} score={}", handler, score);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a route classification call.
     */
    public static LogContext forRoute(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "route");
        return ctx;
    }

    /**
     * Creates a log context for a memory recall search.
     */
    public static LogContext forRecall(String correlationId, String chatId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        if (chatId != null) {
            ctx.put("chatId", chatId);
        }
        ctx.put("operation", "recall");
        return ctx;
    }

    /**
     * Creates a log context for an offline calibration run.
     */
    public static LogContext forCalibration(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("calibrationRunId", runId);
        ctx.put("operation", "calibrate");
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
