package com.gnucash.ledger.importer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

final class KnownLayoutTest {

    private static final List<String> CHASE = List.of(
            "Transaction Date", "Post Date", "Description", "Category", "Type", "Amount", "Memo");
    private static final List<String> BANK_OF_AMERICA = List.of(
            "Posted Date", "Reference Number", "Payee", "Address", "Amount");
    private static final List<String> FIDELITY = List.of(
            "Run Date", "Action", "Symbol", "Security Description", "Quantity", "Amount", "Settlement Date");

    @Test
    void detectsByDistinctiveHeaders() {
        assertEquals(KnownLayout.CHASE, KnownLayout.detect(CHASE));
        assertEquals(KnownLayout.BANK_OF_AMERICA, KnownLayout.detect(BANK_OF_AMERICA));
        assertEquals(KnownLayout.FIDELITY, KnownLayout.detect(FIDELITY));
        assertNull(KnownLayout.detect(List.of("Date", "Description", "Amount")));
    }

    @Test
    void chasePrefersThePostDate() {
        ImportRow row = KnownLayout.CHASE.map(
                List.of("01/14/2024", "01/15/2024", "TRADER JOES #123", "Groceries", "Sale", "-42.50", ""), CHASE);

        assertEquals(LocalDate.of(2024, 1, 15), row.getDate());
        assertEquals(new BigDecimal("-42.50"), row.getAmount());
        assertEquals("TRADER JOES #123", row.getDescription());
        assertNull(row.getMemo());
        assertNull(row.getExternalId());
    }

    @Test
    void chaseFallsBackToTheTransactionDate() {
        ImportRow row = KnownLayout.CHASE.map(
                List.of("01/20/2024", "", "COFFEE", "Food", "Sale", "-4.00", "morning"), CHASE);

        assertEquals(LocalDate.of(2024, 1, 20), row.getDate());
        assertEquals("morning", row.getMemo());
    }

    @Test
    void bankOfAmericaUsesThePayee() {
        ImportRow row = KnownLayout.BANK_OF_AMERICA.map(
                List.of("01/15/2024", "24431", "STARBUCKS", "SEATTLE WA", "-5.25"), BANK_OF_AMERICA);

        assertEquals("STARBUCKS", row.getDescription());
        assertEquals(new BigDecimal("-5.25"), row.getAmount());
    }

    @Test
    void fidelityJoinsActionAndSecurity() {
        ImportRow row = KnownLayout.FIDELITY.map(
                List.of("01/16/2024", "YOU BOUGHT", "VTI", "VANGUARD TOTAL STOCK MKT", "2", "-470.10", "01/18/2024"),
                FIDELITY);

        assertEquals(LocalDate.of(2024, 1, 16), row.getDate());
        assertEquals("YOU BOUGHT VANGUARD TOTAL STOCK MKT", row.getDescription());
        assertEquals("VTI", row.getMemo());
    }

    @Test
    void fidelityNeedsAnExactAmountHeader() {
        List<String> headers = List.of("Run Date", "Action", "Symbol", "Amount ($)");

        assertNull(KnownLayout.FIDELITY.map(List.of("01/16/2024", "DIVIDEND", "VTI", "12.00"), headers));
    }

    @Test
    void unreadableRowsAreDropped() {
        assertNull(KnownLayout.CHASE.map(List.of("Pending", "", "HOLD", "", "", "-1.00", ""), CHASE));
        assertNull(KnownLayout.CHASE.map(List.of("01/14/2024", "01/15/2024", "SHORT ROW"), CHASE));
    }
}
