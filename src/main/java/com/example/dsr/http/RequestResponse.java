package com.example.dsr.http;

import com.example.dsr.models.Request;
import com.example.dsr.models.RequestKind;
import com.example.dsr.models.RequestStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RequestResponse(
        @JsonProperty("request_id") Long requestId,
        @JsonProperty("kind") RequestKind kind,
        @JsonProperty("subject_type") String subjectType,
        @JsonProperty("subject_value") String subjectValue,
        @JsonProperty("status") RequestStatus status,
        @JsonProperty("requested_by") String requestedBy,
        @JsonProperty("assigned_to") String assignedTo,
        @JsonProperty("reason") String reason,
        @JsonProperty("requested_at") Long requestedAt,
        @JsonProperty("completed_at") Long completedAt,
        @JsonProperty("updated_at") Long updatedAt,
        @JsonProperty("total_items") Integer totalItems,
        @JsonProperty("completed_items") Integer completedItems,
        @JsonProperty("failed_items") Integer failedItems,
        @JsonProperty("metadata") Map<String, Object> metadata
) {

    static RequestResponse from(Request request) {
        return new RequestResponse(
                request.getRequestId(),
                request.getKind(),
                request.getSubjectType(),
                request.getSubjectValue(),
                request.getStatus(),
                request.getRequestedBy(),
                request.getAssignedTo(),
                request.getReason(),
                request.getRequestedAt(),
                request.getCompletedAt(),
                request.getUpdatedAt(),
                request.getTotalItems(),
                request.getCompletedItems(),
                request.getFailedItems(),
                request.getMetadata()
        );
    }
}
