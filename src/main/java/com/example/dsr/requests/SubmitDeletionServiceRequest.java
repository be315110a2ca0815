package com.example.dsr.requests;

import com.example.dsr.models.DeletionOptions;
import java.util.Map;
import java.util.Objects;

/**
 * Service-layer command for creating a deletion request. Missing options become
 * {@link DeletionOptions#DEFAULTS}.
 */
public record SubmitDeletionServiceRequest(
        String subjectType,
        String subjectValue,
        String requestedBy,
        String reason,
        DeletionOptions options,
        Map<String, Object> notes,
        String correlationId
) {

    public SubmitDeletionServiceRequest {
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

        options = options == null ? DeletionOptions.DEFAULTS : options;
    }
}
