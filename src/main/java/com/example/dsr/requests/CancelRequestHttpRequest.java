package com.example.dsr.requests;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional body for the cancel endpoints; an anonymous cancel is recorded as the system actor.
 */
public record CancelRequestHttpRequest(
        @JsonProperty("cancelled_by") String cancelledBy
) {}
