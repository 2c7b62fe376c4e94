package com.brainfusion.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the per-request trace id through reactive pipelines.
 *
 * <p>The Reactor Context holds the trace id for the lifetime of a request. MDC is written
 * only while a log statement runs, through {@link #withMdc}, and cleared right after.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(pipeline, traceId);
 *     ...
 *     .doOnEach(signal -> TraceContextUtil.getTraceId(signal.getContextView()))
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY    = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String UNKNOWN         = "unknown";

    private TraceContextUtil() {}

    /** Fresh trace id for requests that arrive without one. */
    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /** Returns {@code candidate} unless it is blank, in which case a new id is generated. */
    public static String resolve(String candidate) {
        return candidate == null || candidate.isBlank() ? newTraceId() : candidate;
    }

    /**
     * Writes {@code traceId} into the subscriber context. Apply at the end of assembly;
     * {@code contextWrite} is visible to every operator above it.
     */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Trace id from the context, {@value #UNKNOWN} when absent. Never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Runs {@code logAction} with {@code traceId} bridged into MDC, then removes it.
     * Only for logging side effects.
     */
    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
