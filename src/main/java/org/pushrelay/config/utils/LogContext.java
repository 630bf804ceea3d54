package org.pushrelay.config.utils;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys shared by every log line of one unit of work: a scheduled run,
 * the delivery of one event, or startup.
 */
public final class LogContext {

    static final String COMPONENT = "component";
    static final String TRACE_ID = "trace.id";

    private LogContext() {}

    public static void start(String component) {
        start(component, null);
    }

    /**
     * @param traceId the event id when one exists; a fresh UUID otherwise
     */
    public static void start(String component, String traceId) {
        MDC.put(COMPONENT, component);
        MDC.put(TRACE_ID, traceId == null || traceId.isBlank() ? UUID.randomUUID().toString() : traceId);
    }

    public static void clear() {
        MDC.remove(COMPONENT);
        MDC.remove(TRACE_ID);
    }
}
