package com.example.dsr.discovery;

import com.example.dsr.access.MetadataCatalog;
import com.example.dsr.config.PlanningProperties;
import com.example.dsr.connector.WarehouseConnector;
import com.example.dsr.models.CatalogTable;
import com.example.dsr.models.TableRef;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Walks the metadata catalog and finds the tables that hold a subject's data.
 *
 * <p>Catalog problems never fail a request: a table whose metadata cannot be read is treated as
 * non-relevant and the walk continues, and a catalog that cannot be listed yields no tables.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TableDiscoveryService {

    private final MetadataCatalog catalog;
    private final WarehouseConnector warehouse;
    private final SubjectColumnMatcher matcher;
    private final RelevanceScorer scorer;
    private final PlanningProperties properties;

    /**
     * Tables worth exporting, most confident first. Ties keep catalog order.
     */
    public List<DiscoveredTable> discoverForExport(String subjectType) {
        List<DiscoveredTable> relevant = new ArrayList<>();
        for (CatalogTable table : listTables()) {
            TableRef ref = table.ref();
            try {
                List<ColumnMatch> matches = matcher.match(subjectType, catalog.listColumns(ref));
                if (matches.isEmpty()) {
                    continue;
                }
                double confidence = scorer.score(ref, matches);
                if (confidence < properties.getMinExportConfidence()) {
                    log.debug("Skipping {} for export: confidence {} below threshold", ref, confidence);
                    continue;
                }
                relevant.add(new DiscoveredTable(ref, matches, confidence, 0));
            } catch (RuntimeException ex) {
                log.warn("Skipping {} during export discovery: {}", ref, ex.getMessage());
            }
        }
        relevant.sort(Comparator.comparingDouble(DiscoveredTable::confidence).reversed());
        log.info("Export discovery for subject type {} found {} tables", subjectType, relevant.size());
        return relevant;
    }

    /**
     * Base tables where the warehouse expects at least one row for the subject, in catalog order.
     */
    public List<DiscoveredTable> discoverForDeletion(String subjectType, String subjectValue) {
        List<DiscoveredTable> locations = new ArrayList<>();
        for (CatalogTable table : listTables()) {
            if (!table.baseTable()) {
                continue;
            }
            TableRef ref = table.ref();
            try {
                List<ColumnMatch> matches = matcher.match(subjectType, catalog.listColumns(ref));
                if (matches.isEmpty()) {
                    continue;
                }
                List<String> columns = matches.stream().map(ColumnMatch::columnName).toList();
                long estimatedRows = warehouse.estimateMatchingRows(ref, columns, subjectValue);
                if (estimatedRows > 0) {
                    locations.add(new DiscoveredTable(ref, matches, scorer.score(ref, matches), estimatedRows));
                }
            } catch (RuntimeException ex) {
                log.warn("Skipping {} during deletion discovery: {}", ref, ex.getMessage());
            }
        }
        log.info("Deletion discovery for subject type {} found {} tables", subjectType, locations.size());
        return locations;
    }

    /**
     * Tables that {@code table} references. Lookup failures degrade to no dependencies.
     */
    public List<String> dependenciesOf(TableRef table) {
        try {
            return catalog.listForeignKeys(table);
        } catch (RuntimeException ex) {
            log.warn("Failed to analyze dependencies for table {}: {}", table, ex.getMessage());
            return List.of();
        }
    }

    private List<CatalogTable> listTables() {
        try {
            return catalog.listTables();
        } catch (RuntimeException ex) {
            log.error("Failed to list catalog tables: {}", ex.getMessage(), ex);
            return List.of();
        }
    }
}
