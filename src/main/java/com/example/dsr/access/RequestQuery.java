package com.example.dsr.access;

import com.example.dsr.models.Request;
import com.example.dsr.models.RequestKind;
import com.example.dsr.models.RequestStatus;

/**
 * Filter for listing requests. Null criteria match everything.
 */
public record RequestQuery(
        RequestKind kind,
        RequestStatus status,
        String subjectType,
        String requestedBy,
        Integer limit
) {

    public static final int DEFAULT_LIMIT = 100;

    public RequestQuery {
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public int effectiveLimit() {
        return limit == null ? DEFAULT_LIMIT : limit;
    }

    public boolean matches(Request request) {
        return (kind == null || kind == request.getKind())
                && (status == null || status == request.getStatus())
                && (subjectType == null || subjectType.equals(request.getSubjectType()))
                && (requestedBy == null || requestedBy.equals(request.getRequestedBy()));
    }
}
