package com.dealflow.dedup.logging;

import com.dealflow.dedup.core.model.DetectionOperation;
import com.dealflow.dedup.core.model.EntityKind;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. On close each key gets back the value it had before
 * the context was opened, so a detection nested inside a batch keeps the batch's entries.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forDetection(correlationId, EntityKind.DEAL, dealId)) {
 *     log.info("duplicate.detected matches={}", matches.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String ENTITY_KIND = "entityKind";
    public static final String ENTITY_ID = "entityId";
    public static final String OPERATION = "operation";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Opens a context for one operation on one entity kind. A null {@code entityId}
     * leaves that key untouched.
     */
    public static LogContext forOperation(DetectionOperation operation, String correlationId,
                                          EntityKind kind, String entityId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(ENTITY_KIND, kind.getTag());
        if (entityId != null) {
            ctx.put(ENTITY_ID, entityId);
        }
        ctx.put(OPERATION, operation.getTag());
        return ctx;
    }

    public static LogContext forDetection(String correlationId, EntityKind kind, String entityId) {
        return forOperation(DetectionOperation.DETECT, correlationId, kind, entityId);
    }

    public static LogContext forBatch(String correlationId, EntityKind kind) {
        return forOperation(DetectionOperation.BATCH, correlationId, kind, null);
    }

    public static LogContext forCluster(String correlationId, EntityKind kind) {
        return forOperation(DetectionOperation.CLUSTER, correlationId, kind, null);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Returns the correlation id already in the MDC, or a fresh one.
     */
    public static String currentOrNewCorrelationId() {
        String current = MDC.get(CORRELATION_ID);
        return current != null ? current : generateCorrelationId();
    }

    /**
     * Adds a key-value pair that is restored with the rest on close.
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
