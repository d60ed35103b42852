package com.b2b.inventory.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Trace id handling for HTTP requests: reuse the caller's X-Trace-Id when present,
 * otherwise generate one, and expose it in MDC and on the response.
 */
public final class TraceContext {

    public static final String TRACE_ID = "traceId";
    public static final String SPAN_ID = "spanId";
    public static final String TRACE_HEADER = "X-Trace-Id";

    private TraceContext() {}

    public static String open(HttpServletRequest request, HttpServletResponse response) {
        String traceId = request.getHeader(TRACE_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = generateTraceId();
        }

        MDC.put(TRACE_ID, traceId);
        MDC.put(SPAN_ID, generateSpanId());

        if (response != null) {
            response.setHeader(TRACE_HEADER, traceId);
        }
        return traceId;
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static String generateSpanId() {
        return generateTraceId().substring(0, 16);
    }

    public static void clear() {
        MDC.remove(TRACE_ID);
        MDC.remove(SPAN_ID);
    }
}
