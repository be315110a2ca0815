package com.example.dsr.discovery;

import com.example.dsr.config.PlanningProperties;
import com.example.dsr.models.PlannedTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decides whether a deletion plan may run unattended. Each rule is evaluated on its own and any
 * triggered rule adds a warning and forces human approval.
 */
@Component
@RequiredArgsConstructor
public class DeletionRiskAssessor {

    public static final String LARGE_DELETION_WARNING = "Large number of records to be deleted (>10,000)";
    public static final String DEPENDENCY_WARNING = "Some tables have referential dependencies";
    public static final String CRITICAL_TABLE_WARNING = "Critical business tables will be affected";

    private final PlanningProperties properties;

    public RiskAssessment assess(List<PlannedTable> tables, long totalEstimatedRows) {
        List<String> warnings = new ArrayList<>();

        if (totalEstimatedRows > properties.getLargeDeletionThreshold()) {
            warnings.add(LARGE_DELETION_WARNING);
        }
        if (tables.stream().anyMatch(table -> !table.dependencies().isEmpty())) {
            warnings.add(DEPENDENCY_WARNING);
        }
        if (tables.stream().anyMatch(table -> isCriticalTable(table.tableName()))) {
            warnings.add(CRITICAL_TABLE_WARNING);
        }
        return new RiskAssessment(List.copyOf(warnings), !warnings.isEmpty());
    }

    boolean isCriticalTable(String tableName) {
        String lower = tableName.toLowerCase(Locale.ROOT);
        return properties.getCriticalTablePatterns().stream()
                .map(pattern -> pattern.toLowerCase(Locale.ROOT))
                .anyMatch(lower::contains);
    }

    public record RiskAssessment(List<String> warnings, boolean requiresApproval) { }
}
