package com.gnucash.ledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gnucash.ledger.config.LedgerConfig;
import com.gnucash.ledger.importer.ImportResult;
import com.gnucash.ledger.importer.ImportRow;
import com.gnucash.ledger.ledger.Account;
import com.gnucash.ledger.ledger.AccountType;
import com.gnucash.ledger.ledger.LedgerData;
import com.gnucash.ledger.ledger.Split;
import com.gnucash.ledger.ledger.Transaction;
import com.gnucash.ledger.testing.SampleLedger;
import com.gnucash.ledger.testing.SteppingClock;
import com.gnucash.ledger.writer.EntityNotFoundException;
import com.gnucash.ledger.writer.WriteMode;
import com.gnucash.ledger.writer.WriteReceipt;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class LedgerServiceTest {

    private static final String STATEMENT = String.join("\n",
            "<OFX><BANKACCTFROM><BANKID>121000248<ACCTID>555<ACCTTYPE>CHECKING</BANKACCTFROM>",
            "<BANKTRANLIST>",
            "<STMTTRN><DTPOSTED>20240115<TRNAMT>-42.50<FITID>1234<NAME>TRADER JOES #123</STMTTRN>",
            "<STMTTRN><DTPOSTED>20240220<TRNAMT>-4.75<FITID>9001<NAME>BLUE BOTTLE</STMTTRN>",
            "</BANKTRANLIST></OFX>");

    @TempDir
    Path tempDir;

    private Path ledger;
    private LedgerService service;

    @BeforeEach
    void setUp() throws Exception {
        ledger = SampleLedger.writeTo(tempDir);
        service = LedgerService.open(
                ledger,
                new SteppingClock(Instant.parse("2024-03-01T12:00:00Z"), Duration.ofSeconds(1)),
                ZoneId.of("UTC"),
                6);
    }

    @Test
    void readsAndWritesThroughOneCache() throws Exception {
        LedgerData before = service.readLedger();
        assertEquals(SampleLedger.TRANSACTION_COUNT, before.getTransactions().size());

        WriteReceipt receipt = service.writeTransaction(null, coffee("txn-coffee"), WriteMode.CREATE);

        assertNotNull(receipt.getAuditLogPath());
        LedgerData after = service.readLedger();
        assertEquals(SampleLedger.TRANSACTION_COUNT + 1, after.getTransactions().size());
        assertEquals(SampleLedger.TRANSACTION_COUNT, before.getTransactions().size(), "snapshots are immutable");
        assertFalse(service.reload(), "own writes do not count as external changes");
    }

    @Test
    void accountLifecycle() throws Exception {
        Account travel = Account.of("travel", "Travel", AccountType.EXPENSE, SampleLedger.EXPENSES, "", false);

        service.writeAccount(travel, WriteMode.CREATE);
        service.renameAccount("travel", "Travel & Holidays");

        LedgerData ledger = service.readLedger();
        assertEquals("Expenses:Travel & Holidays", ledger.fullName("travel"));

        service.writeAccount(travel, WriteMode.DELETE);
        assertTrue(service.readLedger().findAccount("travel").isEmpty());
        assertThrows(EntityNotFoundException.class, () -> service.renameAccount("travel", "Gone"));
    }

    @Test
    void importFlagsRowsAlreadyInTheBook() throws Exception {
        ImportResult result = service.importStatement(
                STATEMENT.getBytes(StandardCharsets.UTF_8), "download.qfx", null, SampleLedger.CHECKING);

        assertEquals("121000248 555 CHECKING", result.getSuggestedAccountHint());
        List<ImportRow> rows = result.getRows();
        assertEquals(2, rows.size());
        assertTrue(rows.get(0).isDuplicate());
        assertFalse(rows.get(1).isDuplicate());

        service.writeTransaction(null, coffee("txn-coffee"), WriteMode.CREATE);
        ImportResult again = service.importStatement(
                STATEMENT.getBytes(StandardCharsets.UTF_8), "download.qfx", null, SampleLedger.CHECKING);
        assertTrue(again.getRows().get(1).isDuplicate(), "matched by amount, date and description");
    }

    @Test
    void unmappedStatementIsReturnedAsIs() throws Exception {
        byte[] csv = "When,Who,How much\n1/15/2024,Shop,42.50\n".getBytes(StandardCharsets.UTF_8);

        ImportResult result = service.importStatement(csv, "export.csv", null, null);

        assertTrue(result.isNeedsMapping());
        assertTrue(result.getRows().isEmpty());
    }

    @Test
    void reloadPicksUpExternalEdits() throws Exception {
        service.readLedger();
        assertFalse(service.reload());

        SampleLedger.writeTo(ledger, SampleLedger.xml().replace("TRADER JOES #123 PURCHASE", "Edited in GnuCash"));

        assertTrue(service.reload());
        assertEquals(
                "Edited in GnuCash",
                service.readLedger().findTransaction(SampleLedger.GROCERY_TXN).orElseThrow().getDescription());
    }

    @Test
    void concurrentWritersDoNotLoseUpdates() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<WriteReceipt>> writes = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                String id = "txn-parallel-" + i;
                writes.add(() -> service.writeTransaction(null, coffee(id), WriteMode.CREATE));
            }
            for (Future<WriteReceipt> future : pool.invokeAll(writes)) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(SampleLedger.TRANSACTION_COUNT + 8, service.readLedger().getTransactions().size());
    }

    @Test
    void openFromConfiguration() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(LedgerConfig.FILE_PROPERTY, ledger.toString());
        LedgerConfig config = LedgerConfig.resolve(properties, Map.of(), tempDir.resolve(".env"));

        LedgerService configured = LedgerService.open(config);

        assertEquals(ledger, configured.getLedgerPath());
        assertEquals(SampleLedger.ACCOUNT_COUNT, configured.readLedger().getAccounts().size());
        assertTrue(Files.exists(ledger));
    }

    private static Transaction coffee(String id) {
        return new Transaction(
                id,
                "Blue Bottle",
                LocalDate.of(2024, 2, 20),
                null,
                "",
                "USD",
                "",
                List.of(
                        Split.of(id + "-checking", SampleLedger.CHECKING, new BigDecimal("-4.75"), ""),
                        Split.of(id + "-dining", SampleLedger.DINING, new BigDecimal("4.75"), "latte")),
                List.of());
    }
}
