package com.gnucash.ledger.jdbc.schema;

import com.gnucash.ledger.ledger.LedgerData;
import com.gnucash.ledger.ledger.Transaction;
import java.util.ArrayList;
import java.util.List;

/** One row per transaction, in file order. */
public final class TransactionTable {
    public static final String NAME = "transactions";

    private static final TableDefinition DEFINITION = new TableDefinition(
            NAME,
            "Transactions without their splits",
            List.of(
                    Columns.varchar("id", false),
                    Columns.date("date_posted", true),
                    Columns.date("date_entered", true),
                    Columns.varchar("description", false),
                    Columns.varchar("notes", true),
                    Columns.varchar("currency", false),
                    Columns.varchar("num", true),
                    Columns.integer("split_count")));

    private TransactionTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(LedgerData ledger) {
        List<Object[]> rows = new ArrayList<>(ledger.getTransactions().size());
        for (Transaction transaction : ledger.getTransactions()) {
            rows.add(new Object[] {
                transaction.getId(),
                Columns.epochDay(transaction.getDatePosted()),
                Columns.epochDay(transaction.getDateEntered()),
                transaction.getDescription(),
                Columns.emptyToNull(transaction.getNotes()),
                transaction.getCurrency(),
                Columns.emptyToNull(transaction.getNum()),
                transaction.getSplits().size()
            });
        }
        return rows;
    }
}
