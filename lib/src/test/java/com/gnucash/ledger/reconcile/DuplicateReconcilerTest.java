package com.gnucash.ledger.reconcile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gnucash.ledger.importer.ImportRow;
import com.gnucash.ledger.ledger.Account;
import com.gnucash.ledger.ledger.AccountType;
import com.gnucash.ledger.ledger.LedgerData;
import com.gnucash.ledger.ledger.Split;
import com.gnucash.ledger.ledger.Transaction;
import com.gnucash.ledger.loader.LedgerReader;
import com.gnucash.ledger.testing.SampleLedger;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class DuplicateReconcilerTest {

    private LedgerData ledger;

    @BeforeEach
    void setUp() throws Exception {
        ledger = LedgerReader.parse(SampleLedger.xml());
    }

    @Test
    void externalIdMatchesStoredOnlineId() {
        ImportRow row = row("1234", LocalDate.of(2024, 3, 1), "Unrelated", "99.00");

        assertTrue(flag(row, null));
        assertTrue(flag(row, SampleLedger.DINING), "exact ids are checked across the whole book");
    }

    @Test
    void sameAmountNearbyDateAndSimilarDescription() {
        assertTrue(flag(row(null, LocalDate.of(2024, 1, 16), "Trader Joes 123", "-42.50"), SampleLedger.CHECKING));
        assertTrue(flag(row(null, LocalDate.of(2024, 1, 14), "TRADER JOE'S", "42.50"), null));
    }

    @Test
    void nearMissesAreNotFlagged() {
        assertFalse(flag(row(null, LocalDate.of(2024, 1, 16), "Trader Joes 123", "-42.51"), null));
        assertFalse(flag(row(null, LocalDate.of(2024, 1, 17), "Trader Joes 123", "-42.50"), null));
        assertFalse(flag(row(null, LocalDate.of(2024, 1, 15), "Whole Foods", "-42.50"), null));
        assertFalse(flag(row("9999", LocalDate.of(2024, 1, 15), "", "-42.50"), null));
    }

    @Test
    void longerImportedDescriptionMatchesShorterStoredOne() {
        Transaction stored = Transaction.of(
                "t-tj",
                "Trader Joes 123",
                LocalDate.of(2024, 3, 10),
                List.of(
                        Split.of("s-1", "card", new BigDecimal("-42.50"), ""),
                        Split.of("s-2", "food", new BigDecimal("42.50"), "")));
        LedgerData book = new LedgerData(
                List.of(
                        Account.of("card", "Card", AccountType.CREDIT, null, "", false),
                        Account.of("food", "Food", AccountType.EXPENSE, null, "", false)),
                List.of(stored));

        List<ImportRow> flagged = DuplicateReconciler.reconcile(
                List.of(
                        row(null, LocalDate.of(2024, 3, 11), "TRADER JOES #123 PURCHASE", "-42.50"),
                        row(null, LocalDate.of(2024, 3, 11), "TRADER JOES #123 PURCHASE", "-42.51")),
                book,
                "card");

        assertTrue(flagged.get(0).isDuplicate());
        assertFalse(flagged.get(1).isDuplicate());
    }

    @Test
    void targetAccountNarrowsFuzzyMatching() {
        ImportRow payroll = row(null, LocalDate.of(2024, 1, 31), "PAYROLL ACME CORP", "2000.00");

        assertTrue(flag(payroll, SampleLedger.CHECKING));
        assertFalse(flag(payroll, SampleLedger.DINING));
    }

    @Test
    void flagsAreSetWithoutReordering() {
        List<ImportRow> rows = List.of(
                row(null, LocalDate.of(2024, 2, 1), "New purchase", "-10.00"),
                row("1234.0", LocalDate.of(2024, 1, 15), "TRADER JOES", "-42.50"));

        List<ImportRow> flagged = DuplicateReconciler.reconcile(rows, ledger, SampleLedger.CHECKING);

        assertEquals(2, flagged.size());
        assertFalse(flagged.get(0).isDuplicate());
        assertTrue(flagged.get(1).isDuplicate());
        assertEquals("New purchase", flagged.get(0).getDescription());
    }

    @Test
    void descriptionNormalization() {
        assertEquals("traderjoes123purchas", DuplicateIndex.normalizeDescription("TRADER JOES #123 PURCHASE"));
        assertEquals("", DuplicateIndex.normalizeDescription(null));
        assertEquals("2024-01-15|42.50", DuplicateIndex.fuzzyKey(LocalDate.of(2024, 1, 15), new BigDecimal("-42.5")));
        assertTrue(DuplicateIndex.prefixCompatible("", ""));
        assertFalse(DuplicateIndex.prefixCompatible("abc", ""));
    }

    private boolean flag(ImportRow row, String targetAccountId) {
        return DuplicateReconciler.reconcile(List.of(row), ledger, targetAccountId).get(0).isDuplicate();
    }

    private static ImportRow row(String externalId, LocalDate date, String description, String amount) {
        return new ImportRow(externalId, date, description, new BigDecimal(amount), null);
    }
}
