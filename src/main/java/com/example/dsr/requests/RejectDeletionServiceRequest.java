package com.example.dsr.requests;

import java.util.Objects;

public record RejectDeletionServiceRequest(
        long requestId,
        String approver,
        String reason
) {

    public RejectDeletionServiceRequest {
        Objects.requireNonNull(approver, "approver");
        if (approver.isBlank()) {
            throw new IllegalArgumentException("approver must be non-blank");
        }

        Objects.requireNonNull(reason, "reason");
        if (reason.isBlank()) {
            throw new IllegalArgumentException("reason must be non-blank");
        }
    }
}
