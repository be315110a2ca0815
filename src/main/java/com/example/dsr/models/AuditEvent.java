package com.example.dsr.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collections;
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
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class AuditEvent {

    // Required fields: Lombok @NonNull enforces runtime null checks in builder
    @NonNull private Long requestId;     // PK
    @NonNull private String tsUlid;      // SK "{millis}_{chain position}"
    @NonNull private EventType eventType;
    @NonNull private String actor;
    @NonNull private Long timestamp;
    @NonNull private String prevHash;

    // no @NonNull here, builder fills it automatically
    private String hash;

    // Optional fields
    private String correlationId;
    private String tableRef;
    private Map<String, Object> details;

    // ----- DynamoDB annotations on getters -----
    @DynamoDbPartitionKey
    @DynamoDbAttribute("request_id")
    public Long getRequestId() { return requestId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("ts_ulid")
    public String getTsUlid() { return tsUlid; }

    @DynamoDbAttribute("event_type")
    public EventType getEventType() { return eventType; }

    @DynamoDbAttribute("actor")
    public String getActor() { return actor; }

    @DynamoDbAttribute("timestamp")
    public Long getTimestamp() { return timestamp; }

    @DynamoDbAttribute("prev_hash")
    public String getPrevHash() { return prevHash; }

    @DynamoDbAttribute("hash")
    public String getHash() { return hash; }

    @DynamoDbAttribute("correlation_id")
    public String getCorrelationId() { return correlationId; }

    @DynamoDbAttribute("table_ref")
    public String getTableRef() { return tableRef; }

    @DynamoDbConvertedBy(JsonStringMapAttributeConverter.class)
    @DynamoDbAttribute("details")
    public Map<String, Object> getDetails() { return details; }

    public enum EventType {
        REQUEST_SUBMITTED,
        PLAN_GENERATED,
        APPROVED,
        REJECTED,
        CANCELLED,

        PROCESSING_STARTED,
        ITEM_COMPLETED,
        ITEM_FAILED,
        REQUEST_COMPLETED,
        REQUEST_FAILED;

        @JsonCreator
        public static EventType fromString(String v) {
            for (EventType t : values()) {
                if (t.name().equals(v)) {
                    return t;
                }
            }
            throw new IllegalArgumentException("Unknown AuditEvent.EventType: " + v);
        }
    }

    // hash chain helpers
    public static String computeHash(AuditEvent e) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            String detailsJson = JsonStringMapAttributeConverter.toJsonString(
                    e.details == null ? Collections.emptyMap() : e.details
            );
            String canon = String.join("|",
                    e.requestId == null ? "" : String.valueOf(e.requestId),
                    nn(e.tsUlid),
                    e.eventType == null ? "" : e.eventType.name(),
                    nn(e.actor),
                    nn(e.correlationId),
                    nn(e.tableRef),
                    e.timestamp == null ? "" : String.valueOf(e.timestamp),
                    detailsJson,
                    nn(e.prevHash)
            );
            byte[] digest = md.digest(canon.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(digest);
        } catch (Exception ex) {
            throw new IllegalStateException("Failed to compute AuditEvent hash", ex);
        }
    }

    private static String nn(String s) { return s == null ? "" : s; }

    private static String bytesToHex(byte[] bytes) {
        final char[] hex = "0123456789abcdef".toCharArray();
        char[] out = new char[bytes.length * 2];
        for (int i = 0, j = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[j++] = hex[v >>> 4];
            out[j++] = hex[v & 0x0F];
        }
        return new String(out);
    }

    public static class AuditEventBuilder {
        public AuditEvent build() {
            AuditEvent e = new AuditEvent(
                    requestId, tsUlid, eventType, actor, timestamp, prevHash,
                    null, correlationId, tableRef, details
            );
            e.hash = computeHash(e);
            return e;
        }
    }
}
