package com.gnucash.ledger.jdbc.schema;

import com.gnucash.ledger.ledger.Account;
import com.gnucash.ledger.ledger.LedgerData;
import java.util.ArrayList;
import java.util.List;

/** One row per account, root included. */
public final class AccountTable {
    public static final String NAME = "accounts";

    private static final TableDefinition DEFINITION = new TableDefinition(
            NAME,
            "Chart of accounts",
            List.of(
                    Columns.varchar("id", false),
                    Columns.varchar("name", false),
                    Columns.varchar("full_name", false),
                    Columns.varchar("type", false),
                    Columns.varchar("parent_id", true),
                    Columns.varchar("description", true),
                    Columns.bool("placeholder"),
                    Columns.bool("hidden"),
                    Columns.varchar("commodity", true)));

    private AccountTable() {}

    public static TableDefinition getDefinition() {
        return DEFINITION;
    }

    public static List<Object[]> materializeRows(LedgerData ledger) {
        List<Object[]> rows = new ArrayList<>(ledger.getAccounts().size());
        for (Account account : ledger.getAccounts()) {
            rows.add(new Object[] {
                account.getId(),
                account.getName(),
                ledger.fullName(account.getId()),
                account.getType().name(),
                account.getParentId(),
                Columns.emptyToNull(account.getDescription()),
                account.isPlaceholder(),
                account.isHidden(),
                account.getCommodityId()
            });
        }
        return rows;
    }
}
