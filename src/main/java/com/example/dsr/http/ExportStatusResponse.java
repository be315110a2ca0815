package com.example.dsr.http;

import com.example.dsr.service.ExportStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ExportStatusResponse(
        @JsonProperty("request") RequestResponse request,
        @JsonProperty("items") List<RequestItemResponse> items,
        @JsonProperty("progress") ProgressResponse progress
) {

    static ExportStatusResponse from(ExportStatus status) {
        return new ExportStatusResponse(
                RequestResponse.from(status.request()),
                status.items().stream().map(RequestItemResponse::from).toList(),
                ProgressResponse.from(status.progress(), null)
        );
    }
}
