package com.example.dsr.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Crawled table inventory row. Written by the catalog crawler, read-only here.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class CatalogTable {

    public static final String BASE_TABLE = "BASE TABLE";

    @NonNull private String tableRef;   // PK "db.schema.table"
    @NonNull private String databaseName;
    @NonNull private String schemaName;
    @NonNull private String tableName;
    private String tableType;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("table_ref")
    public String getTableRef() { return tableRef; }

    @DynamoDbAttribute("database_name")
    public String getDatabaseName() { return databaseName; }

    @DynamoDbAttribute("schema_name")
    public String getSchemaName() { return schemaName; }

    @DynamoDbAttribute("table_name")
    public String getTableName() { return tableName; }

    @DynamoDbAttribute("table_type")
    public String getTableType() { return tableType; }

    public TableRef ref() {
        return new TableRef(databaseName, schemaName, tableName);
    }

    public boolean baseTable() {
        return tableType == null || BASE_TABLE.equalsIgnoreCase(tableType);
    }

    public static CatalogTable of(TableRef ref, String tableType) {
        return CatalogTable.builder()
                .tableRef(ref.qualifiedName())
                .databaseName(ref.databaseName())
                .schemaName(ref.schemaName())
                .tableName(ref.tableName())
                .tableType(tableType)
                .build();
    }
}
