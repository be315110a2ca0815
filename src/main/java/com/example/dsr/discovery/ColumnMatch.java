package com.example.dsr.discovery;

/**
 * A catalog column judged to hold subject data, with a name-based relevance in [0, 1].
 */
public record ColumnMatch(String columnName, String dataType, double relevance) {
}
