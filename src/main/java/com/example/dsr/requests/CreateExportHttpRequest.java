package com.example.dsr.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * HTTP-layer payload for POST /export-requests. {@code notes} is an optional free-form document
 * stored with the request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateExportHttpRequest(
        @JsonProperty("subject_type") @NotBlank String subjectType,
        @JsonProperty("subject_value") @NotBlank String subjectValue,
        @JsonProperty("requested_by") @NotBlank String requestedBy,
        @JsonProperty("reason") String reason,
        @JsonProperty("notes") Map<String, Object> notes
) {}
