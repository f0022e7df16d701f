package com.auctionagent.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Reactive trace propagation for decision runs.
 *
 * <p>The Reactor Context carries {@code traceId} and the auction {@code domain} through a
 * pipeline. MDC is written only while a log statement runs, never as ambient thread state.
 *
 * <pre>
 *     return TraceContextUtil.withTrace(pipeline, traceId, ctx.domain());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String DOMAIN_KEY = "domain";

    private TraceContextUtil() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    public static <T> Mono<T> withTrace(Mono<T> mono, String traceId, String domain) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId)
                                           .put(DOMAIN_KEY, domain == null ? "unknown" : domain));
    }

    /** Returns {@code "unknown"} if absent, never {@code null}. */
    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, "unknown");
    }

    public static String getDomain(ContextView ctx) {
        return ctx.getOrDefault(DOMAIN_KEY, "unknown");
    }

    /**
     * Bridges {@code traceId} into MDC for the duration of {@code logAction} only.
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
