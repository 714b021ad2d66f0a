package com.gnucash.ledger.importer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.List;
import org.junit.jupiter.api.Test;

final class GenericColumnMatcherTest {

    @Test
    void matchesCommonHeaderNames() {
        ColumnMapping mapping = GenericColumnMatcher.match(List.of("Date", "Description", "Amount", "Memo"));

        assertEquals(0, mapping.getDateColumn());
        assertEquals(1, mapping.getDescriptionColumn());
        assertEquals(2, mapping.getAmountColumn());
        assertEquals(3, mapping.getMemoColumn());
        assertFalse(mapping.isNegateAmount());
    }

    @Test
    void patternOrderDecidesBetweenCandidates() {
        ColumnMapping mapping = GenericColumnMatcher.match(
                List.of("Balance Amount", "Value Date", "Payee Name", "Debit/Credit", "Date"));

        assertEquals(4, mapping.getDateColumn(), "an exact Date header beats a partial match");
        assertEquals(2, mapping.getDescriptionColumn());
        assertEquals(3, mapping.getAmountColumn());
        assertNull(mapping.getMemoColumn());
    }

    @Test
    void missingColumnMeansNoMapping() {
        assertNull(GenericColumnMatcher.match(List.of("Date", "Amount")));
        assertNull(GenericColumnMatcher.match(List.of("When", "Who", "How much")));
    }
}
