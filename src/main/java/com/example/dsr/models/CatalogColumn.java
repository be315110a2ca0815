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
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class CatalogColumn {

    @NonNull private String tableRef;     // PK
    @NonNull private String columnName;   // SK
    private String dataType;
    private Integer ordinalPosition;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("table_ref")
    public String getTableRef() { return tableRef; }

    @DynamoDbSortKey
    @DynamoDbAttribute("column_name")
    public String getColumnName() { return columnName; }

    @DynamoDbAttribute("data_type")
    public String getDataType() { return dataType; }

    @DynamoDbAttribute("ordinal_position")
    public Integer getOrdinalPosition() { return ordinalPosition; }

    public static CatalogColumn of(TableRef table, String columnName, String dataType) {
        return CatalogColumn.builder()
                .tableRef(table.qualifiedName())
                .columnName(columnName)
                .dataType(dataType)
                .build();
    }
}
