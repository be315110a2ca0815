package com.example.dsr.requests;

import com.example.dsr.models.RequestKind;
import java.util.Objects;

/**
 * Service-layer command for cancelling a pending request of either kind.
 */
public record CancelRequestServiceRequest(
        RequestKind kind,
        long requestId,
        String cancelledBy
) {

    public static final String SYSTEM_ACTOR = "system";

    public CancelRequestServiceRequest {
        Objects.requireNonNull(kind, "kind");
        cancelledBy = (cancelledBy == null || cancelledBy.isBlank()) ? SYSTEM_ACTOR : cancelledBy;
    }
}
