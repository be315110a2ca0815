package com.example.dsr.requests;

import java.util.Objects;

public record ApproveDeletionServiceRequest(
        long requestId,
        String approver
) {

    public ApproveDeletionServiceRequest {
        Objects.requireNonNull(approver, "approver");
        if (approver.isBlank()) {
            throw new IllegalArgumentException("approver must be non-blank");
        }
    }
}
