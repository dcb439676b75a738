package com.docflow.engine.logging;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs include relevant correlation IDs for tracing.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forInstance(instanceId, "review")) {
 *     log.info("Completing task"); // Automatically includes instanceId, nodeId
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String INSTANCE_ID = "instanceId";
    public static final String NODE_ID = "nodeId";
    public static final String DEFINITION = "definition";
    public static final String ACTOR = "actor";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for instance-level operations.
     */
    public static LoggingContext forInstance(UUID instanceId) {
        return forInstance(instanceId, null);
    }

    /**
     * Create a logging context for an operation on one node of an instance.
     */
    public static LoggingContext forInstance(UUID instanceId, String nodeId) {
        LoggingContext ctx = new LoggingContext();
        if (instanceId != null) {
            MDC.put(INSTANCE_ID, instanceId.toString());
        }
        if (nodeId != null) {
            MDC.put(NODE_ID, nodeId);
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for definition operations (publish, deactivate).
     */
    public static LoggingContext forDefinition(String definitionKey) {
        LoggingContext ctx = new LoggingContext();
        if (definitionKey != null) {
            MDC.put(DEFINITION, definitionKey);
        }
        ensureTraceId();
        return ctx;
    }

    public static void setDefinition(String definitionKey) {
        if (definitionKey != null) {
            MDC.put(DEFINITION, definitionKey);
        }
    }

    public static void setActor(String actorId) {
        if (actorId != null) {
            MDC.put(ACTOR, actorId);
        }
    }

    public static String getInstanceId() {
        return MDC.get(INSTANCE_ID);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(INSTANCE_ID);
        MDC.remove(NODE_ID);
        MDC.remove(DEFINITION);
        MDC.remove(ACTOR);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or scheduler poll.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
