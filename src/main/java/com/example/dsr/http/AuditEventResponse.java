package com.example.dsr.http;

import com.example.dsr.models.AuditEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEventResponse(
        @JsonProperty("request_id") Long requestId,
        @JsonProperty("ts_ulid") String tsUlid,
        @JsonProperty("event_type") AuditEvent.EventType eventType,
        @JsonProperty("actor") String actor,
        @JsonProperty("correlation_id") String correlationId,
        @JsonProperty("table_ref") String tableRef,
        @JsonProperty("timestamp") Long timestamp,
        @JsonProperty("prev_hash") String prevHash,
        @JsonProperty("hash") String hash,
        @JsonProperty("details") Map<String, Object> details
) { }
