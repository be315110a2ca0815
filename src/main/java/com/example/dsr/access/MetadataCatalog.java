package com.example.dsr.access;

import com.example.dsr.models.CatalogColumn;
import com.example.dsr.models.CatalogTable;
import com.example.dsr.models.TableRef;
import java.util.List;

/**
 * Read-only view over the crawled table/column/foreign-key inventory. The inventory is eventually
 * consistent; discovery quality is bounded by how fresh the crawl is.
 */
public interface MetadataCatalog {

    /**
     * Every catalogued table ordered by database, schema and table name.
     */
    List<CatalogTable> listTables();

    List<CatalogColumn> listColumns(TableRef table);

    /**
     * Names of the tables that {@code table} references through foreign keys.
     */
    List<String> listForeignKeys(TableRef table);
}
