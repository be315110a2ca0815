package com.example.dsr.connector;

import com.example.dsr.config.WarehouseProperties;
import com.example.dsr.models.DeletionOptions;
import com.example.dsr.models.TableRef;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Stand-in connector for environments without a warehouse. Row counts are derived from table
 * naming conventions and a stable hash of the subject, so repeated calls agree with each other
 * and a plan's estimates match what "deletion" later reports.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "dsr.warehouse.mode", havingValue = "simulated", matchIfMissing = true)
public class SimulatedWarehouseConnector implements WarehouseConnector {

    private final WarehouseProperties properties;

    @Override
    public long estimateMatchingRows(TableRef table, List<String> columns, String subjectValue) {
        checkAvailable(table);
        String name = table.tableName().toLowerCase(Locale.ROOT);
        if (name.contains("user") || name.contains("customer") || name.contains("profile")) {
            return 1;
        }
        if (name.contains("order") || name.contains("transaction") || name.contains("purchase")) {
            return 1 + spread(table, subjectValue, 50);
        }
        if (name.contains("log") || name.contains("audit") || name.contains("event")) {
            return 1 + spread(table, subjectValue, 500);
        }
        return 1 + spread(table, subjectValue, 10);
    }

    @Override
    public List<Map<String, Object>> extractRows(TableRef table, List<String> columns, String subjectValue) {
        checkAvailable(table);
        log.info("Simulating extraction from {} on columns {}", table, columns);

        String name = table.tableName().toLowerCase(Locale.ROOT);
        if (name.contains("user") || name.contains("customer")) {
            return List.of(row(table, Map.of(
                    "id", subjectValue,
                    "created_at", "2023-01-15T10:30:00Z",
                    "updated_at", "2024-01-15T10:30:00Z")));
        }
        if (name.contains("order") || name.contains("transaction")) {
            return List.of(
                    row(table, Map.of(
                            "order_id", "ORD-001",
                            "user_id", subjectValue,
                            "amount", 99.99,
                            "created_at", "2024-01-10T14:22:00Z")),
                    row(table, Map.of(
                            "order_id", "ORD-002",
                            "user_id", subjectValue,
                            "amount", 149.99,
                            "created_at", "2024-02-15T09:15:00Z")));
        }
        return List.of();
    }

    @Override
    public long deleteRows(TableRef table, List<String> columns, String subjectValue, DeletionOptions options) {
        long affected = estimateMatchingRows(table, columns, subjectValue);
        log.info("Simulating {} deletion of {} rows from {} (cascade={}, backup={})",
                options.deletionType(), affected, table, options.cascadeDelete(), options.backupBeforeDelete());
        return affected;
    }

    private void checkAvailable(TableRef table) {
        boolean unavailable = properties.getUnavailableTables().stream()
                .anyMatch(t -> t.equalsIgnoreCase(table.qualifiedName()));
        if (unavailable) {
            throw WarehouseException.tableUnavailable(table);
        }
    }

    private static long spread(TableRef table, String subjectValue, int bound) {
        return Math.floorMod((table.normalizedKey() + "|" + subjectValue).hashCode(), bound);
    }

    private static Map<String, Object> row(TableRef table, Map<String, Object> values) {
        Map<String, Object> row = new LinkedHashMap<>();
        // Map.of has no iteration order; keep a readable column order for CSV output.
        values.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> row.put(e.getKey(), e.getValue()));
        row.put("table_source", table.qualifiedName());
        return row;
    }
}
