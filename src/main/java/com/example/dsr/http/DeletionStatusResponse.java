package com.example.dsr.http;

import com.example.dsr.models.DeletionPlan;
import com.example.dsr.service.DeletionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeletionStatusResponse(
        @JsonProperty("request") RequestResponse request,
        @JsonProperty("items") List<RequestItemResponse> items,
        @JsonProperty("plan") DeletionPlan plan,
        @JsonProperty("progress") ProgressResponse progress
) {

    static DeletionStatusResponse from(DeletionStatus status) {
        return new DeletionStatusResponse(
                RequestResponse.from(status.request()),
                status.items().stream().map(RequestItemResponse::from).toList(),
                status.plan(),
                ProgressResponse.from(status.progress(), status.totalDeletedRows())
        );
    }
}
