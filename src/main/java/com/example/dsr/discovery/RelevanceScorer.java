package com.example.dsr.discovery;

import com.example.dsr.models.TableRef;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Turns per-column matches into a table-level confidence: 60% column strength, a 0.3 bonus for
 * subject-bearing table names and a 0.1 bonus for subject-bearing schema names, capped at 1.0.
 */
@Component
public class RelevanceScorer {

    private static final double COLUMN_WEIGHT = 0.6;
    private static final double TABLE_BONUS = 0.3;
    private static final double SCHEMA_BONUS = 0.1;

    private static final List<String> TABLE_WORDS =
            List.of("user", "customer", "account", "profile", "contact", "order", "transaction");
    private static final List<String> SCHEMA_WORDS = List.of("user", "customer", "crm");

    public double score(TableRef table, List<ColumnMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            return 0;
        }
        double meanRelevance = matches.stream().mapToDouble(ColumnMatch::relevance).average().orElse(0);
        double score = meanRelevance * COLUMN_WEIGHT;

        if (containsAny(table.tableName(), TABLE_WORDS)) {
            score += TABLE_BONUS;
        }
        if (containsAny(table.schemaName(), SCHEMA_WORDS)) {
            score += SCHEMA_BONUS;
        }
        return Math.min(score, 1.0);
    }

    private static boolean containsAny(String name, List<String> words) {
        String lower = name.toLowerCase(Locale.ROOT);
        return words.stream().anyMatch(lower::contains);
    }
}
