package com.example.dsr.requests;

import java.util.Map;
import java.util.Objects;

/**
 * Service-layer command for creating an export request, built from
 * {@link CreateExportHttpRequest} plus the caller's correlation id.
 */
public record SubmitExportServiceRequest(
        String subjectType,
        String subjectValue,
        String requestedBy,
        String reason,
        Map<String, Object> notes,
        String correlationId
) {

    public SubmitExportServiceRequest {
        Objects.requireNonNull(subjectType, "subjectType");
        if (subjectType.isBlank()) {
            throw new IllegalArgumentException("subjectType must be non-blank");
        }

        Objects.requireNonNull(subjectValue, "subjectValue");
        if (subjectValue.isBlank()) {
            throw new IllegalArgumentException("subjectValue must be non-blank");
        }

        Objects.requireNonNull(requestedBy, "requestedBy");
        if (requestedBy.isBlank()) {
            throw new IllegalArgumentException("requestedBy must be non-blank");
        }
    }
}
