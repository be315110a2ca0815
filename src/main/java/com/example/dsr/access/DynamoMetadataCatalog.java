package com.example.dsr.access;

import com.example.dsr.models.CatalogColumn;
import com.example.dsr.models.CatalogForeignKey;
import com.example.dsr.models.CatalogTable;
import com.example.dsr.models.TableRef;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

/**
 * Reads the inventory the catalog crawler maintains in DynamoDB.
 */
@Component
public class DynamoMetadataCatalog implements MetadataCatalog {

    public static final String TABLES_TABLE = "catalog_tables";
    public static final String COLUMNS_TABLE = "catalog_columns";
    public static final String FOREIGN_KEYS_TABLE = "catalog_foreign_keys";

    private static final Comparator<CatalogTable> CATALOG_ORDER = Comparator
            .comparing(CatalogTable::getDatabaseName)
            .thenComparing(CatalogTable::getSchemaName)
            .thenComparing(CatalogTable::getTableName);

    private final DynamoDbTable<CatalogTable> tables;
    private final DynamoDbTable<CatalogColumn> columns;
    private final DynamoDbTable<CatalogForeignKey> foreignKeys;

    public DynamoMetadataCatalog(DynamoDbEnhancedClient enhancedClient) {
        this.tables = enhancedClient.table(TABLES_TABLE, TableSchema.fromBean(CatalogTable.class));
        this.columns = enhancedClient.table(COLUMNS_TABLE, TableSchema.fromBean(CatalogColumn.class));
        this.foreignKeys = enhancedClient.table(FOREIGN_KEYS_TABLE, TableSchema.fromBean(CatalogForeignKey.class));
    }

    @Override
    public List<CatalogTable> listTables() {
        return tables.scan()
                .items()
                .stream()
                .sorted(CATALOG_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public List<CatalogColumn> listColumns(TableRef table) {
        // Crawler-supplied ordinal wins; the sort key order is the fallback.
        return columns.query(QueryConditional.keyEqualTo(buildKey(table)))
                .items()
                .stream()
                .sorted(Comparator.comparing(
                        (CatalogColumn c) -> c.getOrdinalPosition() == null ? Integer.MAX_VALUE : c.getOrdinalPosition()))
                .collect(Collectors.toList());
    }

    @Override
    public List<String> listForeignKeys(TableRef table) {
        return foreignKeys.query(QueryConditional.keyEqualTo(buildKey(table)))
                .items()
                .stream()
                .map(CatalogForeignKey::getReferencedTableName)
                .distinct()
                .collect(Collectors.toList());
    }

    private Key buildKey(TableRef table) {
        return Key.builder().partitionValue(table.qualifiedName()).build();
    }
}
