package com.knowledge.fusion.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forFusion(LogContext.generateCorrelationId(), "entity")) {
 *     log.info("fusion.entities.completed clusterCount={}", clusters.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one fusion pass over entities or relations.
     */
    public static LogContext forFusion(String batchId, String itemKind) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("itemKind", itemKind);
        ctx.put("operation", "fuse");
        return ctx;
    }

    /**
     * Creates a log context for a conflict detection/resolution batch.
     */
    public static LogContext forConflicts(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "resolve-conflicts");
        return ctx;
    }

    /**
     * Creates a log context for merging another graph into a store.
     */
    public static LogContext forGraphMerge(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "graph-merge");
        return ctx;
    }

    /**
     * Creates a log context for loading or exporting persisted state.
     */
    public static LogContext forPersistence(String correlationId, String format) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("format", format);
        ctx.put("operation", "persistence");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
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
