package com.example.dsr.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * HTTP-layer payload for previewing a deletion plan without creating a request.
 */
public record DeletionPlanHttpRequest(
        @JsonProperty("subject_type") @NotBlank String subjectType,
        @JsonProperty("subject_value") @NotBlank String subjectValue
) {}
