package com.talent.sourcing.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Puts key-value pairs into the SLF4J MDC and, on close, restores
 * whatever the keys held before, so contexts can nest.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forStage(runId, "DISCOVERY")) {
 *     log.info("discovery.completed candidates={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Context for a whole pipeline run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        return ctx;
    }

    /**
     * Context for one stage of a pipeline run.
     */
    public static LogContext forStage(String runId, String stage) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("stage", stage);
        return ctx;
    }

    /**
     * Context for person-search session operations.
     */
    public static LogContext forSession(String sessionId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("sessionId", sessionId);
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Generates a unique run or session identifier.
     */
    public static String generateId() {
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
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
