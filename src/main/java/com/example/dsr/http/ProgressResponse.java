package com.example.dsr.http;

import com.example.dsr.service.RequestProgress;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * {@code total_deleted_rows} is only reported for deletion requests.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressResponse(
        @JsonProperty("total_items") int totalItems,
        @JsonProperty("completed_items") int completedItems,
        @JsonProperty("failed_items") int failedItems,
        @JsonProperty("total_deleted_rows") Long totalDeletedRows,
        @JsonProperty("percentage") int percentage
) {

    static ProgressResponse from(RequestProgress progress, Long totalDeletedRows) {
        return new ProgressResponse(
                progress.totalItems(),
                progress.completedItems(),
                progress.failedItems(),
                totalDeletedRows,
                progress.percentage()
        );
    }
}
