package com.example.frontdesk.infra.exec;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Propagates the SLF4J MDC across async boundaries.
 *
 * <p>Pooled threads are reused, so the previous MDC is always restored in {@code finally};
 * otherwise a callId could leak into an unrelated call's log lines.</p>
 */
public final class ContextPropagation {

    private ContextPropagation() {
    }

    /** Capture the caller's MDC now, apply it when the task runs. */
    public static Runnable wrap(Runnable task) {
        if (task == null) {
            return () -> {
            };
        }
        final Map<String, String> captured = MDC.getCopyOfContextMap();
        return () -> {
            final Map<String, String> prev = MDC.getCopyOfContextMap();
            try {
                applyMdc(captured);
                task.run();
            } finally {
                applyMdc(prev);
            }
        };
    }

    private static void applyMdc(Map<String, String> mdc) {
        if (mdc == null || mdc.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(mdc);
        }
    }
}
