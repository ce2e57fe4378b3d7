package com.tradeadmission.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Trace id of an admission cycle. The id doubles as the cycle id in results and block
 * records; Reactor Context carries it, MDC sees it only inside {@link #withMdc}.
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";
    public static final String UNKNOWN      = "unknown";

    private TraceContextUtil() {}

    /** Caller-supplied id when present, otherwise a fresh random one. */
    public static String resolveCycleId(String requested) {
        if (requested == null || requested.isBlank()) {
            return UUID.randomUUID().toString();
        }
        return requested.trim();
    }

    /** Attach at the end of assembly; the id is visible to every operator upstream. */
    public static <T> Mono<T> withTraceId(Mono<T> mono, String traceId) {
        return mono.contextWrite(ctx -> ctx.put(TRACE_ID_KEY, traceId != null ? traceId : UNKNOWN));
    }

    public static String getTraceId(ContextView ctx) {
        return ctx.getOrDefault(TRACE_ID_KEY, UNKNOWN);
    }

    public static void withMdc(String traceId, Runnable logAction) {
        MDC.put(TRACE_ID_KEY, traceId != null ? traceId : UNKNOWN);
        try {
            logAction.run();
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
