package com.agentcouncil.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.concurrent.Callable;

/**
 * Lightweight reactive tracing utility.
 *
 * <p>Reactor Context is the single source of truth for the run's traceId inside the pipeline.
 * MDC is only written as a temporary bridge during a log statement, never as a persistent
 * ThreadLocal store, because stages hop between {@code boundedElastic} workers.
 *
 * <p>Usage in the driver:
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /**
     * Stores {@code traceId} in the Reactor Context of {@code mono}; call at the end of the
     * assembly since {@code contextWrite} propagates upstream.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** The run's traceId, or {@code "unknown"} outside a pipeline run. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Bridges {@code traceId} into MDC while {@code logAction} runs. Only use inside logging
     * side-effects.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        String previous = MDC.get(TRACE_ID_KEY);
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            restore(previous);
        }
    }

    /**
     * Runs a stage body with {@code traceId} in MDC so its own log lines carry the run's id.
     * Worker threads are shared between runs; the previous MDC value is put back afterwards.
     */
    public static <T> T callWithMdc(String traceId, Callable<T> body) throws Exception {
        String previous = MDC.get(TRACE_ID_KEY);
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            return body.call();
        } finally {
            restore(previous);
        }
    }

    private static void restore(String previous) {
        if (previous == null) {
            MDC.remove(TRACE_ID_KEY);
        } else {
            MDC.put(TRACE_ID_KEY, previous);
        }
    }
}
