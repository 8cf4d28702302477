package com.placeguide.recommend.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;

public final class RequestIdUtil {
    public static final String TRACE_HEADER = "x-trace-id";
    public static final String REQUEST_HEADER = "x-request-id";

    private RequestIdUtil() {
    }

    public static String resolveOrGenerate(String value) {
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        return UUID.randomUUID().toString();
    }

    public static String traceId(HttpServletRequest request) {
        return resolveOrGenerate(request == null ? null : request.getHeader(TRACE_HEADER));
    }

    public static String requestId(HttpServletRequest request) {
        return resolveOrGenerate(request == null ? null : request.getHeader(REQUEST_HEADER));
    }
}
