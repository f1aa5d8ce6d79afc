package org.example.course.config;

import jakarta.servlet.http.HttpServletRequest;

public final class RequestContext {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_TIER_HEADER = "X-User-Tier";
    public static final String REQUEST_ID_KEY = "requestId";
    public static final String USER_ID_KEY = "userId";
    public static final String UNKNOWN = "unknown";

    private RequestContext() {
    }

    public static String resolveRequestId(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        if (request.getAttribute(REQUEST_ID_KEY) instanceof String value && !value.isBlank()) {
            return value;
        }
        return UNKNOWN;
    }
}
