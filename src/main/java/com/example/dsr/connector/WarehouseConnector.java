package com.example.dsr.connector;

import com.example.dsr.models.DeletionOptions;
import com.example.dsr.models.TableRef;
import java.util.List;
import java.util.Map;

/**
 * Executes the row-level work for one table. Building the filtering predicate, retries and
 * backoff are the connector's concern; callers treat each method as one opaque call.
 */
public interface WarehouseConnector {

    /**
     * Estimates how many rows of {@code table} hold the subject's data.
     */
    long estimateMatchingRows(TableRef table, List<String> columns, String subjectValue);

    /**
     * Reads the subject's rows from {@code table}.
     */
    List<Map<String, Object>> extractRows(TableRef table, List<String> columns, String subjectValue);

    /**
     * Removes, or soft-deletes when {@code options.softDelete()} is set, the subject's rows.
     *
     * @return number of rows affected
     */
    long deleteRows(TableRef table, List<String> columns, String subjectValue, DeletionOptions options);
}
