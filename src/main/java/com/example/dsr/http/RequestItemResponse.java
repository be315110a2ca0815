package com.example.dsr.http;

import com.example.dsr.models.RequestItem;
import com.example.dsr.models.RequestStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RequestItemResponse(
        @JsonProperty("sequence") Integer sequence,
        @JsonProperty("database_name") String databaseName,
        @JsonProperty("schema_name") String schemaName,
        @JsonProperty("table_name") String tableName,
        @JsonProperty("columns") List<String> columns,
        @JsonProperty("status") RequestStatus status,
        @JsonProperty("affected_rows") Long affectedRows,
        @JsonProperty("deletion_order") Integer deletionOrder,
        @JsonProperty("result_data") Map<String, Object> resultData,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("processed_at") Long processedAt
) {

    static RequestItemResponse from(RequestItem item) {
        return new RequestItemResponse(
                item.getSequence(),
                item.getDatabaseName(),
                item.getSchemaName(),
                item.getTableName(),
                item.getColumns(),
                item.getStatus(),
                item.getAffectedRows(),
                item.getDeletionOrder(),
                item.getResultData(),
                item.getErrorMessage(),
                item.getProcessedAt()
        );
    }
}
