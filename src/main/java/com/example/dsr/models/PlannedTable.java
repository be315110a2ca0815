package com.example.dsr.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One entry of a {@link DeletionPlan}: where the subject's rows live, how many are expected and
 * the position at which the table is processed.
 */
public record PlannedTable(
        @JsonProperty("database_name") String databaseName,
        @JsonProperty("schema_name") String schemaName,
        @JsonProperty("table_name") String tableName,
        @JsonProperty("columns") List<String> columns,
        @JsonProperty("estimated_rows") long estimatedRows,
        @JsonProperty("dependencies") List<String> dependencies,
        @JsonProperty("deletion_order") int deletionOrder
) {

    public PlannedTable {
        columns = columns == null ? List.of() : List.copyOf(columns);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public PlannedTable(TableRef ref, List<String> columns, long estimatedRows, List<String> dependencies) {
        this(ref.databaseName(), ref.schemaName(), ref.tableName(), columns, estimatedRows, dependencies, 0);
    }

    @JsonIgnore
    public TableRef ref() {
        return new TableRef(databaseName, schemaName, tableName);
    }

    public PlannedTable withDeletionOrder(int order) {
        return new PlannedTable(databaseName, schemaName, tableName, columns, estimatedRows, dependencies, order);
    }
}
