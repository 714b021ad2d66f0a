package com.gnucash.ledger.jdbc.schema;

import com.gnucash.ledger.codec.FractionCodec;
import com.gnucash.ledger.ledger.LedgerData;
import com.gnucash.ledger.ledger.Split;
import com.gnucash.ledger.ledger.Transaction;
import java.util.ArrayList;
import java.util.List;

/**
 * One row per split, grouped by transaction in file order. The posted date and the account's full
 * name are repeated on each row so simple register queries need no join.
 */
public final class SplitTable {
    public static final String NAME = "splits";

    private static final TableDefinition DEFINITION = new TableDefinition(
            NAME,
            "Transaction splits",
            List.of(
                    Columns.varchar("id", false),
                    Columns.varchar("transaction_id", false),
                    Columns.date("date_posted", true),
                    Columns.varchar("account_id", false),
                    Columns.varchar("account_name", false),
                    Columns.amount("value"),
                    Columns.amount("quantity"),
                    Columns.flag("reconciled_state"),
                    Columns.date("reconcile_date", true),
                    Columns.varchar("memo", true),
                    Columns.varchar("action", true),
                    Columns.varchar("online_id", true)));

    private SplitTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(LedgerData ledger) {
        List<Object[]> rows = new ArrayList<>();
        for (Transaction transaction : ledger.getTransactions()) {
            for (Split split : transaction.getSplits()) {
                rows.add(new Object[] {
                    split.getId(),
                    transaction.getId(),
                    Columns.epochDay(transaction.getDatePosted()),
                    split.getAccountId(),
                    ledger.fullName(split.getAccountId()),
                    FractionCodec.round(split.getValue()),
                    FractionCodec.round(split.getQuantity()),
                    split.getReconciledState().toCode(),
                    Columns.epochDay(split.getReconcileDate()),
                    Columns.emptyToNull(split.getMemo()),
                    Columns.emptyToNull(split.getAction()),
                    split.getOnlineId()
                });
            }
        }
        return rows;
    }
}
