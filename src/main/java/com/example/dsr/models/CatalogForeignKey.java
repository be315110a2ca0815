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

/**
 * Foreign-key edge from {@code tableRef} to the table it references. The referenced name is
 * whatever the crawler recorded: a bare table name or a qualified one.
 */
@DynamoDbBean
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter @Setter
public class CatalogForeignKey {

    @NonNull private String tableRef;              // PK
    @NonNull private String referencedTableName;   // SK

    @DynamoDbPartitionKey
    @DynamoDbAttribute("table_ref")
    public String getTableRef() { return tableRef; }

    @DynamoDbSortKey
    @DynamoDbAttribute("referenced_table_name")
    public String getReferencedTableName() { return referencedTableName; }

    public static CatalogForeignKey of(TableRef table, String referencedTableName) {
        return CatalogForeignKey.builder()
                .tableRef(table.qualifiedName())
                .referencedTableName(referencedTableName)
                .build();
    }
}
