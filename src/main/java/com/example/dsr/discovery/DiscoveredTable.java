package com.example.dsr.discovery;

import com.example.dsr.models.TableRef;
import java.util.List;

/**
 * A table that discovery considers relevant for a subject.
 *
 * @param confidence table-level relevance, used by export filtering
 * @param estimatedRows connector estimate, populated for deletion discovery only
 */
public record DiscoveredTable(
        TableRef ref,
        List<ColumnMatch> matches,
        double confidence,
        long estimatedRows
) {

    public DiscoveredTable {
        matches = List.copyOf(matches);
    }

    public List<String> columnNames() {
        return matches.stream().map(ColumnMatch::columnName).toList();
    }
}
