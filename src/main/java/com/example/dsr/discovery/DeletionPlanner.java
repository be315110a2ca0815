package com.example.dsr.discovery;

import com.example.dsr.models.DeletionPlan;
import com.example.dsr.models.PlannedTable;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds a {@link DeletionPlan}: discovery, dependency lookup, sequencing and risk assessment.
 * Has no side effects, so it also serves plan previews.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeletionPlanner {

    private final TableDiscoveryService discoveryService;
    private final DependencySequencer sequencer;
    private final DeletionRiskAssessor riskAssessor;

    public DeletionPlan generatePlan(String subjectType, String subjectValue) {
        List<DiscoveredTable> locations = discoveryService.discoverForDeletion(subjectType, subjectValue);

        List<PlannedTable> candidates = new ArrayList<>(locations.size());
        for (DiscoveredTable location : locations) {
            candidates.add(new PlannedTable(
                    location.ref(),
                    location.columnNames(),
                    location.estimatedRows(),
                    discoveryService.dependenciesOf(location.ref())));
        }

        DependencySequencer.SequencingResult sequencing = sequencer.sequence(candidates);
        if (sequencing.hasCycles()) {
            log.warn("Deletion plan for subject type {} contains dependency cycles among {}",
                    subjectType, sequencing.cyclicTables());
        }

        List<PlannedTable> ordered = sequencing.orderedTables();
        long totalEstimatedRows = ordered.stream().mapToLong(PlannedTable::estimatedRows).sum();
        DeletionRiskAssessor.RiskAssessment risk = riskAssessor.assess(ordered, totalEstimatedRows);

        log.info("Generated deletion plan for subject type {}: tables={}, estimated_rows={}, requires_approval={}",
                subjectType, ordered.size(), totalEstimatedRows, risk.requiresApproval());
        return new DeletionPlan(ordered, totalEstimatedRows, risk.warnings(), risk.requiresApproval());
    }
}
