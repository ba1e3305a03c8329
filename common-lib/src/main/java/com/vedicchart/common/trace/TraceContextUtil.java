package com.vedicchart.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the request trace id through chart pipelines.
 *
 * <p>The Reactor Context holds the id for the lifetime of a request. MDC is written only
 * around an individual log statement and cleared straight after, so a worker thread never
 * keeps a stale id.
 *
 * <pre>
 *     return TraceContextUtil.withTraceId(chartService.compute(request), traceId);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String UNKNOWN = "unknown";

    private TraceContextUtil() {}

    /** The incoming header value, or a fresh id when the caller sent none. */
    public static String resolve(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return headerValue.trim();
    }

    /** Call at the end of assembly: {@code contextWrite} applies to operators upstream of it. */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId));
    }

    /** Never null; {@value #UNKNOWN} when no id was written. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    /**
     * Runs {@code logAction} with the trace id in MDC and removes it afterwards.
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
