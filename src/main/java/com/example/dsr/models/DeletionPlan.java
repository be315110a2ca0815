package com.example.dsr.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Ordered, risk-annotated list of tables to erase for one subject. Computed once when the
 * deletion request is submitted and stored under {@code metadata.deletion_plan}.
 */
public record DeletionPlan(
        @JsonProperty("tables_to_process") List<PlannedTable> tablesToProcess,
        @JsonProperty("total_estimated_rows") long totalEstimatedRows,
        @JsonProperty("warnings") List<String> warnings,
        @JsonProperty("requires_approval") boolean requiresApproval
) {

    public DeletionPlan {
        tablesToProcess = tablesToProcess == null ? List.of() : List.copyOf(tablesToProcess);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
