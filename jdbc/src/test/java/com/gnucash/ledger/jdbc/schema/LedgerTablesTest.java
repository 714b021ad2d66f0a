package com.gnucash.ledger.jdbc.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gnucash.ledger.jdbc.testing.TestLedgers;
import com.gnucash.ledger.ledger.LedgerData;
import com.gnucash.ledger.loader.LedgerReader;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class LedgerTablesTest {

    private LedgerData ledger;

    @BeforeEach
    void setUp() throws Exception {
        ledger = LedgerReader.parse(TestLedgers.xml(TestLedgers.SAMPLE));
    }

    @Test
    void rowsMatchTheirDefinitions() {
        assertWidth(AccountTable.getDefinition(), AccountTable.materializeRows(ledger));
        assertWidth(TransactionTable.getDefinition(), TransactionTable.materializeRows(ledger));
        assertWidth(SplitTable.getDefinition(), SplitTable.materializeRows(ledger));
    }

    @Test
    void accountRowsCarryFullNames() {
        TableDefinition definition = AccountTable.getDefinition();
        Object[] checking = find(AccountTable.materializeRows(ledger), definition.indexOf("id"), "checking");

        assertEquals("Assets:Checking", checking[definition.indexOf("full_name")]);
        assertEquals("BANK", checking[definition.indexOf("type")]);
        assertEquals("assets", checking[definition.indexOf("parent_id")]);
        assertEquals(Boolean.FALSE, checking[definition.indexOf("placeholder")]);
        assertEquals("USD", checking[definition.indexOf("commodity")]);
    }

    @Test
    void transactionRowsUseEpochDays() {
        TableDefinition definition = TransactionTable.getDefinition();
        Object[] payroll = find(TransactionTable.materializeRows(ledger), definition.indexOf("id"), "txn-payroll");

        assertEquals(
                Math.toIntExact(LocalDate.of(2024, 1, 31).toEpochDay()),
                payroll[definition.indexOf("date_posted")]);
        assertEquals("1001", payroll[definition.indexOf("num")]);
        assertEquals(2, payroll[definition.indexOf("split_count")]);
        assertNull(payroll[definition.indexOf("notes")]);
    }

    @Test
    void splitRowsRoundValuesToCents() {
        TableDefinition definition = SplitTable.getDefinition();
        List<Object[]> rows = SplitTable.materializeRows(ledger);
        Object[] checking = find(rows, definition.indexOf("id"), "split-tj-checking");

        assertEquals(4, rows.size());
        assertEquals(new BigDecimal("-42.50"), checking[definition.indexOf("value")]);
        assertEquals("c", checking[definition.indexOf("reconciled_state")]);
        assertEquals("1234.000000", checking[definition.indexOf("online_id")]);
        assertNull(checking[definition.indexOf("memo")]);
        assertEquals("Assets:Checking", checking[definition.indexOf("account_name")]);
    }

    @Test
    void columnLookupMatchesExactNames() {
        TableDefinition definition = SplitTable.getDefinition();

        assertEquals(5, definition.indexOf("value"));
        assertEquals(-1, definition.indexOf("VALUE"));
        assertEquals(-1, definition.indexOf("balance"));
        assertTrue(definition.getColumns().get(definition.indexOf("memo")).isNullable());
        assertFalse(definition.getColumns().get(definition.indexOf("value")).isNullable());
    }

    @Test
    void epochDayConversion() {
        assertNull(Columns.epochDay(null));
        assertEquals(19737, Columns.epochDay(LocalDate.of(2024, 1, 15)));
        assertNull(Columns.emptyToNull(""));
    }

    private static void assertWidth(TableDefinition definition, List<Object[]> rows) {
        assertFalse(rows.isEmpty(), definition.getName());
        for (Object[] row : rows) {
            assertEquals(definition.getColumns().size(), row.length, definition.getName());
        }
    }

    private static Object[] find(List<Object[]> rows, int idColumn, String id) {
        for (Object[] row : rows) {
            if (id.equals(row[idColumn])) {
                return row;
            }
        }
        throw new AssertionError("No row " + id);
    }
}
