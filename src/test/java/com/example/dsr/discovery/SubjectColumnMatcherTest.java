package com.example.dsr.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.dsr.models.CatalogColumn;
import com.example.dsr.models.TableRef;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SubjectColumnMatcherTest {

    private static final TableRef TABLE = new TableRef("shop", "public", "customers");

    private final SubjectColumnMatcher matcher = new SubjectColumnMatcher();

    @Test
    @DisplayName("scores exact, affix and contained pattern hits")
    void scoresByPatternPosition() {
        List<ColumnMatch> matches = matcher.match("email", columns("email", "email_address", "primary_email_hash", "status"));

        assertEquals(3, matches.size());
        assertEquals(SubjectColumnMatcher.EXACT, matches.get(0).relevance());
        assertEquals(SubjectColumnMatcher.AFFIX, matches.get(1).relevance());
        assertEquals(SubjectColumnMatcher.CONTAINS, matches.get(2).relevance());
    }

    @Test
    @DisplayName("first pattern that a column contains decides its score")
    void firstPatternWins() {
        // "user_email" would be exact for a later pattern, but "email" comes first
        List<ColumnMatch> matches = matcher.match("email", columns("user_email"));

        assertEquals(1, matches.size());
        assertEquals(SubjectColumnMatcher.AFFIX, matches.get(0).relevance());
    }

    @Test
    @DisplayName("matching ignores case and keeps the catalog spelling")
    void caseInsensitive() {
        List<ColumnMatch> matches = matcher.match("EMAIL", columns("Email"));

        assertEquals(1, matches.size());
        assertEquals("Email", matches.get(0).columnName());
        assertEquals(SubjectColumnMatcher.EXACT, matches.get(0).relevance());
    }

    @Test
    @DisplayName("columns differing only by case are reported once")
    void deduplicatesColumns() {
        List<ColumnMatch> matches = matcher.match("email", columns("Email", "email"));

        assertEquals(1, matches.size());
        assertEquals("Email", matches.get(0).columnName());
    }

    @Test
    @DisplayName("user_id subject matches generic id columns")
    void userIdMatchesIdColumns() {
        List<ColumnMatch> matches = matcher.match("user_id", columns("id", "order_id", "user_id", "amount"));

        assertEquals(List.of("id", "order_id", "user_id"),
                matches.stream().map(ColumnMatch::columnName).toList());
        assertEquals(SubjectColumnMatcher.EXACT, matches.get(0).relevance());
        assertEquals(SubjectColumnMatcher.AFFIX, matches.get(1).relevance());
        assertEquals(SubjectColumnMatcher.EXACT, matches.get(2).relevance());
    }

    @Test
    @DisplayName("unknown subject types match on their own name")
    void unknownSubjectTypeUsesItsName() {
        assertEquals(List.of("ssn"), matcher.patternsFor(" SSN "));

        List<ColumnMatch> matches = matcher.match("ssn", columns("ssn", "customer_ssn", "email"));

        assertEquals(2, matches.size());
        assertEquals(SubjectColumnMatcher.EXACT, matches.get(0).relevance());
        assertEquals(SubjectColumnMatcher.AFFIX, matches.get(1).relevance());
    }

    @Test
    @DisplayName("no columns yields no matches")
    void emptyColumns() {
        assertTrue(matcher.match("email", List.of()).isEmpty());
        assertTrue(matcher.match("email", null).isEmpty());
    }

    private static List<CatalogColumn> columns(String... names) {
        return Arrays.stream(names)
                .map(name -> CatalogColumn.of(TABLE, name, "VARCHAR"))
                .toList();
    }
}
