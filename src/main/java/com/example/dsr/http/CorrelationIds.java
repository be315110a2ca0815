package com.example.dsr.http;

import org.slf4j.MDC;

/**
 * Access to the correlation id that {@link RequestIdFilter} put on the current thread.
 */
final class CorrelationIds {

    static final String HEADER = "X-Request-Id";
    static final String MDC_KEY = "requestId";

    private CorrelationIds() {
    }

    static String current() {
        return MDC.get(MDC_KEY);
    }
}
