package com.example.dsr.access;

import com.example.dsr.models.CatalogColumn;
import com.example.dsr.models.CatalogTable;
import com.example.dsr.models.TableRef;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog fixture that returns tables in insertion order.
 */
public class InMemoryMetadataCatalog implements MetadataCatalog {

    private final Map<String, CatalogTable> tables = new LinkedHashMap<>();
    private final Map<String, List<CatalogColumn>> columns = new LinkedHashMap<>();
    private final Map<String, List<String>> foreignKeys = new LinkedHashMap<>();

    public InMemoryMetadataCatalog table(TableRef ref, String... columnNames) {
        return typedTable(ref, CatalogTable.BASE_TABLE, columnNames);
    }

    public InMemoryMetadataCatalog typedTable(TableRef ref, String tableType, String... columnNames) {
        tables.put(ref.qualifiedName(), CatalogTable.of(ref, tableType));
        List<CatalogColumn> cols = new ArrayList<>();
        for (String name : columnNames) {
            cols.add(CatalogColumn.of(ref, name, "VARCHAR"));
        }
        columns.put(ref.qualifiedName(), cols);
        return this;
    }

    public InMemoryMetadataCatalog foreignKey(TableRef from, String referencedTableName) {
        foreignKeys.computeIfAbsent(from.qualifiedName(), k -> new ArrayList<>()).add(referencedTableName);
        return this;
    }

    @Override
    public List<CatalogTable> listTables() {
        return new ArrayList<>(tables.values());
    }

    @Override
    public List<CatalogColumn> listColumns(TableRef table) {
        return columns.getOrDefault(table.qualifiedName(), List.of());
    }

    @Override
    public List<String> listForeignKeys(TableRef table) {
        return foreignKeys.getOrDefault(table.qualifiedName(), List.of());
    }
}
