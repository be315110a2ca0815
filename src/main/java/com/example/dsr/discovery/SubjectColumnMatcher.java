package com.example.dsr.discovery;

import com.example.dsr.models.CatalogColumn;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Picks the columns of one table that are likely to identify a subject, purely from column names.
 *
 * <p>Each subject type has an ordered list of name patterns. A column is compared against the
 * patterns in order and the first one it contains decides its score: 1.0 for an exact name,
 * 0.9 when the pattern is a prefix or suffix, 0.8 when it only appears inside the name.
 * Subject types without a pattern list match on their own name.
 */
@Component
public class SubjectColumnMatcher {

    public static final double EXACT = 1.0;
    public static final double AFFIX = 0.9;
    public static final double CONTAINS = 0.8;

    private static final Map<String, List<String>> SUBJECT_PATTERNS = Map.of(
            "user_id", List.of("user_id", "id", "customer_id", "account_id", "member_id"),
            "email", List.of("email", "email_address", "user_email", "contact_email"),
            "customer_id", List.of("customer_id", "client_id", "account_id", "user_id"),
            "phone", List.of("phone", "phone_number", "mobile", "telephone", "cell_phone"),
            "name", List.of("name", "first_name", "last_name", "full_name", "username")
    );

    public List<ColumnMatch> match(String subjectType, List<CatalogColumn> columns) {
        if (columns == null || columns.isEmpty()) {
            return List.of();
        }
        List<String> patterns = patternsFor(subjectType);
        List<ColumnMatch> matches = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (CatalogColumn column : columns) {
            String columnName = column.getColumnName().toLowerCase(Locale.ROOT);
            if (!seen.add(columnName)) {
                continue;
            }
            for (String pattern : patterns) {
                double relevance = score(columnName, pattern);
                if (relevance > 0) {
                    matches.add(new ColumnMatch(column.getColumnName(), column.getDataType(), relevance));
                    break;
                }
            }
        }
        return matches;
    }

    List<String> patternsFor(String subjectType) {
        String key = subjectType.trim().toLowerCase(Locale.ROOT);
        return SUBJECT_PATTERNS.getOrDefault(key, List.of(key));
    }

    static double score(String columnName, String pattern) {
        if (columnName.equals(pattern)) {
            return EXACT;
        }
        if (columnName.startsWith(pattern) || columnName.endsWith(pattern)) {
            return AFFIX;
        }
        if (columnName.contains(pattern)) {
            return CONTAINS;
        }
        return 0;
    }
}
