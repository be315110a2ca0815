package com.example.dsr.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record ApproveDeletionHttpRequest(
        @JsonProperty("approver") @NotBlank String approver
) {}
