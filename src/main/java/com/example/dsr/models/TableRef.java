package com.example.dsr.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;
import java.util.Objects;

/**
 * Fully qualified identity of a catalogued table.
 */
public record TableRef(
        @JsonProperty("database_name") String databaseName,
        @JsonProperty("schema_name") String schemaName,
        @JsonProperty("table_name") String tableName
) {

    public TableRef {
        Objects.requireNonNull(databaseName, "databaseName");
        Objects.requireNonNull(schemaName, "schemaName");
        Objects.requireNonNull(tableName, "tableName");
    }

    public String qualifiedName() {
        return databaseName + "." + schemaName + "." + tableName;
    }

    /**
     * Case-insensitive identity used as a graph key.
     */
    public String normalizedKey() {
        return qualifiedName().toLowerCase(Locale.ROOT);
    }

    public boolean sameSchemaAs(TableRef other) {
        return databaseName.equalsIgnoreCase(other.databaseName)
                && schemaName.equalsIgnoreCase(other.schemaName);
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
