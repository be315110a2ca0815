package com.example.dsr.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * One data-subject-rights case: an export or an erasure of everything held about a subject.
 * Mutated only by the orchestrator; terminal states are final apart from manual resets.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // needed for DynamoDB Enhanced Client reflection
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class Request {

    public static final String META_OPTIONS = "options";
    public static final String META_DELETION_PLAN = "deletion_plan";
    public static final String META_NOTES = "notes";
    public static final String META_RESULT_SUMMARY = "result_summary";
    public static final String META_FAILURE = "failure";

    // Required fields: Lombok @NonNull enforces runtime null checks in builder
    @NonNull private Long requestId;   // PK
    @NonNull private RequestKind kind;
    @NonNull private String subjectType;
    @NonNull private String subjectValue;
    @NonNull private RequestStatus status;
    @NonNull private String requestedBy;
    @NonNull private Long requestedAt;
    @NonNull private Long updatedAt;

    // Optional fields
    private String assignedTo;
    private String reason;
    private String correlationId;
    private Long completedAt;
    private Long queuedAt;
    private Integer totalItems;
    private Integer completedItems;
    private Integer failedItems;
    private Map<String, Object> metadata;

    // ----- DynamoDB annotations on getters -----
    @DynamoDbPartitionKey
    @DynamoDbAttribute("request_id")
    public Long getRequestId() { return requestId; }

    @DynamoDbAttribute("kind")
    public RequestKind getKind() { return kind; }

    @DynamoDbAttribute("subject_type")
    public String getSubjectType() { return subjectType; }

    @DynamoDbAttribute("subject_value")
    public String getSubjectValue() { return subjectValue; }

    @DynamoDbAttribute("status")
    public RequestStatus getStatus() { return status; }

    @DynamoDbAttribute("requested_by")
    public String getRequestedBy() { return requestedBy; }

    @DynamoDbAttribute("requested_at")
    public Long getRequestedAt() { return requestedAt; }

    @DynamoDbAttribute("updated_at")
    public Long getUpdatedAt() { return updatedAt; }

    @DynamoDbAttribute("assigned_to")
    public String getAssignedTo() { return assignedTo; }

    @DynamoDbAttribute("reason")
    public String getReason() { return reason; }

    @DynamoDbAttribute("correlation_id")
    public String getCorrelationId() { return correlationId; }

    @DynamoDbAttribute("completed_at")
    public Long getCompletedAt() { return completedAt; }

    @DynamoDbAttribute("queued_at")
    public Long getQueuedAt() { return queuedAt; }

    @DynamoDbAttribute("total_items")
    public Integer getTotalItems() { return totalItems; }

    @DynamoDbAttribute("completed_items")
    public Integer getCompletedItems() { return completedItems; }

    @DynamoDbAttribute("failed_items")
    public Integer getFailedItems() { return failedItems; }

    @DynamoDbConvertedBy(JsonStringMapAttributeConverter.class)
    @DynamoDbAttribute("metadata")
    public Map<String, Object> getMetadata() { return metadata; }

    /**
     * Copy of the metadata document with one key replaced; never mutates this instance.
     */
    public Map<String, Object> metadataWith(String key, Object value) {
        Map<String, Object> copy = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return copy;
    }

    public boolean hasStatus(RequestStatus expected) {
        return status == expected;
    }
}
