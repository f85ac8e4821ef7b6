package org.crmjobs.config.utils;

import org.slf4j.MDC;

import java.util.Map;
import java.util.UUID;

/**
 * MDC context for log correlation.
 * Adds "component" and "trace.id" to every log entry written while the context is open.
 * Job executions open their own context and restore the caller's one in a finally block.
 */
public class LogContext {
    private LogContext() {}

    public static void start(String component) {
        MDC.put("component", component);
        MDC.put("trace.id", UUID.randomUUID().toString());
    }

    public static void clear() {
        MDC.clear();
    }

    /** Current MDC entries, or null when there are none. */
    public static Map<String, String> snapshot() {
        return MDC.getCopyOfContextMap();
    }

    /** Put back a context taken with {@link #snapshot()}. */
    public static void restore(Map<String, String> previous) {
        if (previous == null) {
            MDC.clear();
        } else {
            MDC.setContextMap(previous);
        }
    }

    public static String getTraceId() {
        return MDC.get("trace.id");
    }
}
