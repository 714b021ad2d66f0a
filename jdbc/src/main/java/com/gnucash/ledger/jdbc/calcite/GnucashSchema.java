package com.gnucash.ledger.jdbc.calcite;

import com.gnucash.ledger.jdbc.schema.AccountTable;
import com.gnucash.ledger.jdbc.schema.SplitTable;
import com.gnucash.ledger.jdbc.schema.TransactionTable;
import com.gnucash.ledger.ledger.LedgerData;
import com.gnucash.ledger.loader.LedgerParseException;
import com.gnucash.ledger.loader.LedgerReader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.calcite.schema.SchemaPlus;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;

/**
 * Calcite schema exposing one GnuCash book as the {@code accounts}, {@code transactions} and
 * {@code splits} tables. Unless a parsed ledger is supplied, the book is read on first access; it
 * is not refreshed afterwards.
 */
public final class GnucashSchema extends AbstractSchema {

    static final String LEDGER_OPERAND = "ledger";
    private static final Logger LOGGER = Logger.getLogger(GnucashSchema.class.getName());

    private final String schemaName;
    private final Path ledgerPath;
    private volatile Map<String, Table> tables;
    private volatile LedgerData ledgerData;

    GnucashSchema(SchemaPlus parentSchema, String name, Map<String, Object> operand) {
        Objects.requireNonNull(parentSchema, "parentSchema");
        this.schemaName = Objects.requireNonNull(name, "name");
        this.ledgerPath = resolveLedgerPath(operand);
    }

    GnucashSchema(SchemaPlus parentSchema, String name, Path ledgerPath, LedgerData ledgerData) {
        Objects.requireNonNull(parentSchema, "parentSchema");
        this.schemaName = Objects.requireNonNull(name, "name");
        this.ledgerPath = Objects.requireNonNull(ledgerPath, "ledgerPath").toAbsolutePath().normalize();
        this.ledgerData = Objects.requireNonNull(ledgerData, "ledgerData");
    }

    @Override
    protected Map<String, Table> getTableMap() {
        Map<String, Table> local = tables;
        if (local == null) {
            local = buildTables();
            tables = local;
        }
        return local;
    }

    public Path getLedgerPath() {
        return ledgerPath;
    }

    private Map<String, Table> buildTables() {
        LedgerData data = loadLedgerData();
        Map<String, Table> map = new LinkedHashMap<>();
        map.put(AccountTable.NAME, new LedgerCalciteTable(AccountTable.getDefinition(), AccountTable.materializeRows(data)));
        map.put(
                TransactionTable.NAME,
                new LedgerCalciteTable(TransactionTable.getDefinition(), TransactionTable.materializeRows(data)));
        map.put(SplitTable.NAME, new LedgerCalciteTable(SplitTable.getDefinition(), SplitTable.materializeRows(data)));
        LOGGER.log(
                Level.FINE,
                "Schema {0} exposes {1} accounts and {2} transactions",
                new Object[] {schemaName, data.getAccounts().size(), data.getTransactions().size()});
        return Map.copyOf(map);
    }

    private LedgerData loadLedgerData() {
        LedgerData current = ledgerData;
        if (current == null) {
            synchronized (this) {
                current = ledgerData;
                if (current == null) {
                    try {
                        current = LedgerReader.read(ledgerPath);
                    } catch (LedgerParseException ex) {
                        throw new IllegalStateException("Failed to load ledger: " + ledgerPath, ex);
                    }
                    ledgerData = current;
                }
            }
        }
        return current;
    }

    private static Path resolveLedgerPath(Map<String, Object> operand) {
        Objects.requireNonNull(operand, "operand");
        Object ledger = operand.get(LEDGER_OPERAND);
        if (ledger == null) {
            throw new IllegalArgumentException("GnuCash schema operand must include '" + LEDGER_OPERAND + "'");
        }
        return Paths.get(ledger.toString()).toAbsolutePath().normalize();
    }
}
