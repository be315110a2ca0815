package com.example.dsr.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record RejectDeletionHttpRequest(
        @JsonProperty("approver") @NotBlank String approver,
        @JsonProperty("reason") @NotBlank String reason
) {}
