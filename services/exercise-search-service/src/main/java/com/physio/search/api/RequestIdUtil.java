package com.physio.search.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

public final class RequestIdUtil {
    private RequestIdUtil() {
    }

    public static String resolveOrGenerate(String value) {
        if (value != null && !value.trim().isEmpty()) {
            return value.trim();
        }
        return UUID.randomUUID().toString();
    }

    public static String resolveOrGenerate(HttpServletRequest request, String headerName) {
        return resolveOrGenerate(request.getHeader(headerName));
    }

    /**
     * Trace id from the header, falling back to the W3C {@code traceparent} header and then to a fresh id.
     */
    public static String resolveTraceId(HttpServletRequest request) {
        String header = request.getHeader("x-trace-id");
        if (header != null && !header.trim().isEmpty()) {
            return header.trim();
        }
        String fromTraceparent = extractTraceId(request.getHeader("traceparent"));
        return fromTraceparent != null ? fromTraceparent : UUID.randomUUID().toString();
    }

    static String extractTraceId(String traceparent) {
        if (traceparent == null || traceparent.isBlank()) {
            return null;
        }
        String[] parts = traceparent.trim().split("-");
        if (parts.length != 4) {
            return null;
        }
        return parts[1];
    }
}
