package org.apiwatch.config.utils;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys shared by every log line: the component doing the work, a trace id per unit of work
 * and, for monitoring jobs, the configuration being called.
 * <p>
 * Call {@link #start} at the top of a request, task run or job and {@link #clear} in its finally block.
 * Pooled threads do not inherit the caller's context, so runnables start their own.
 */
public final class LogContext {
    public static final String COMPONENT = "component";
    public static final String TRACE_ID = "trace.id";
    public static final String CONFIG_ID = "config.id";

    private LogContext() {}

    public static void start(String component) {
        MDC.put(COMPONENT, component);
        MDC.put(TRACE_ID, UUID.randomUUID().toString());
    }

    public static void forConfiguration(String component, long configId) {
        start(component);
        MDC.put(CONFIG_ID, Long.toString(configId));
    }

    public static void clear() {
        MDC.remove(COMPONENT);
        MDC.remove(TRACE_ID);
        MDC.remove(CONFIG_ID);
    }
}
