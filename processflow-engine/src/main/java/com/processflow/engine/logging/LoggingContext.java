package com.processflow.engine.logging;

import com.processflow.core.model.Actor;
import com.processflow.core.model.ProcessInstance;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures all logs of an engine operation carry the instance and caller they concern.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forInstance(instance, actor)) {
 *     log.info("Completing step"); // Automatically includes instanceId, businessKey, actor
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [http-nio-8080-exec-1] INFO  c.p.e.c.ProcessCoordinator - Completing step
 *   instanceId=abc-123 businessKey=INV-2024-001 tenantId=acme actor=alice
 */
public final class LoggingContext implements AutoCloseable {

    public static final String INSTANCE_ID = "instanceId";
    public static final String BUSINESS_KEY = "businessKey";
    public static final String TENANT_ID = "tenantId";
    public static final String DEFINITION_ID = "definitionId";
    public static final String ACTOR = "actor";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
    }

    /**
     * Context for operations on an existing instance.
     */
    public static LoggingContext forInstance(ProcessInstance instance, Actor actor) {
        LoggingContext ctx = forActor(actor);
        MDC.put(INSTANCE_ID, instance.instanceId().toString());
        putIfPresent(BUSINESS_KEY, instance.businessKey());
        putIfPresent(TENANT_ID, instance.tenantId());
        MDC.put(DEFINITION_ID, instance.definitionId().toString());
        return ctx;
    }

    public static LoggingContext forDefinition(UUID definitionId, Actor actor) {
        LoggingContext ctx = forActor(actor);
        if (definitionId != null) {
            MDC.put(DEFINITION_ID, definitionId.toString());
        }
        return ctx;
    }

    private static LoggingContext forActor(Actor actor) {
        LoggingContext ctx = new LoggingContext();
        if (actor != null) {
            putIfPresent(ACTOR, actor.userId());
            putIfPresent(TENANT_ID, actor.tenantId());
        }
        ensureTraceId();
        return ctx;
    }

    /**
     * Add the business key once the instance has been created.
     */
    public static void setBusinessKey(String businessKey) {
        putIfPresent(BUSINESS_KEY, businessKey);
    }

    public static void setInstanceId(UUID instanceId) {
        if (instanceId != null) {
            MDC.put(INSTANCE_ID, instanceId.toString());
        }
    }

    /**
     * Use the caller's request id as trace id, or generate one.
     */
    public static void setTraceId(String traceId) {
        if (traceId != null && !traceId.isBlank()) {
            MDC.put(TRACE_ID, traceId);
        } else {
            MDC.remove(TRACE_ID);
            ensureTraceId();
        }
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(INSTANCE_ID);
        MDC.remove(BUSINESS_KEY);
        MDC.remove(TENANT_ID);
        MDC.remove(DEFINITION_ID);
        MDC.remove(ACTOR);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
