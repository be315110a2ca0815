package com.example.dsr.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * Table-scoped unit of work inside a {@link Request}. The sort key is the 1-based position in
 * which the orchestrator executes the item.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class RequestItem {

    @NonNull private Long requestId;    // PK
    @NonNull private Integer sequence;  // SK
    @NonNull private String databaseName;
    @NonNull private String schemaName;
    @NonNull private String tableName;
    @NonNull private List<String> columns;
    @NonNull private RequestStatus status;
    @NonNull private Long createdAt;
    @NonNull private Long updatedAt;

    private Long affectedRows;
    private Integer deletionOrder;
    private Map<String, Object> resultData;
    private String errorMessage;
    private Long processedAt;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("request_id")
    public Long getRequestId() { return requestId; }

    @DynamoDbSortKey
    @DynamoDbAttribute("sequence")
    public Integer getSequence() { return sequence; }

    @DynamoDbAttribute("database_name")
    public String getDatabaseName() { return databaseName; }

    @DynamoDbAttribute("schema_name")
    public String getSchemaName() { return schemaName; }

    @DynamoDbAttribute("table_name")
    public String getTableName() { return tableName; }

    @DynamoDbAttribute("columns")
    public List<String> getColumns() { return columns; }

    @DynamoDbAttribute("status")
    public RequestStatus getStatus() { return status; }

    @DynamoDbAttribute("created_at")
    public Long getCreatedAt() { return createdAt; }

    @DynamoDbAttribute("updated_at")
    public Long getUpdatedAt() { return updatedAt; }

    @DynamoDbAttribute("affected_rows")
    public Long getAffectedRows() { return affectedRows; }

    @DynamoDbAttribute("deletion_order")
    public Integer getDeletionOrder() { return deletionOrder; }

    @DynamoDbConvertedBy(JsonStringMapAttributeConverter.class)
    @DynamoDbAttribute("result_data")
    public Map<String, Object> getResultData() { return resultData; }

    @DynamoDbAttribute("error_message")
    public String getErrorMessage() { return errorMessage; }

    @DynamoDbAttribute("processed_at")
    public Long getProcessedAt() { return processedAt; }

    public TableRef tableRef() {
        return new TableRef(databaseName, schemaName, tableName);
    }
}
