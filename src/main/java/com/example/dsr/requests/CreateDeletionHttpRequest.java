package com.example.dsr.requests;

import com.example.dsr.models.DeletionOptions;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * HTTP-layer payload for POST /deletion-requests. Omitted options fall back to the safe defaults
 * (soft delete, backup, verification required).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateDeletionHttpRequest(
        @JsonProperty("subject_type") @NotBlank String subjectType,
        @JsonProperty("subject_value") @NotBlank String subjectValue,
        @JsonProperty("requested_by") @NotBlank String requestedBy,
        @JsonProperty("reason") String reason,
        @JsonProperty("options") DeletionOptions options,
        @JsonProperty("notes") Map<String, Object> notes
) {}
