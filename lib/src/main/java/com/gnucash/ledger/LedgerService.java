package com.gnucash.ledger;

import com.gnucash.ledger.config.LedgerConfig;
import com.gnucash.ledger.importer.ColumnMapping;
import com.gnucash.ledger.importer.ImportFormatException;
import com.gnucash.ledger.importer.ImportResult;
import com.gnucash.ledger.importer.ImportRow;
import com.gnucash.ledger.importer.StatementImporter;
import com.gnucash.ledger.ledger.Account;
import com.gnucash.ledger.ledger.LedgerData;
import com.gnucash.ledger.ledger.Transaction;
import com.gnucash.ledger.loader.Compression;
import com.gnucash.ledger.loader.LedgerParseException;
import com.gnucash.ledger.loader.LedgerStore;
import com.gnucash.ledger.reconcile.DuplicateReconciler;
import com.gnucash.ledger.writer.LedgerWriter;
import com.gnucash.ledger.writer.WriteMode;
import com.gnucash.ledger.writer.WriteReceipt;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for callers (CLI, HTTP layer, tests) working on one ledger file.
 *
 * <p>Every mutation and every cache refresh runs under a single lock, so two writers can never
 * patch the same cached text. The {@link LedgerData} handed out is an immutable snapshot and may be
 * used without holding anything. Statement parsing and duplicate detection touch no shared state.</p>
 */
public final class LedgerService {

    private final LedgerStore store;
    private final LedgerWriter writer;
    private final StatementImporter importer;
    private final ReentrantLock lock = new ReentrantLock();

    public LedgerService(LedgerStore store, LedgerWriter writer, StatementImporter importer) {
        this.store = Objects.requireNonNull(store, "store");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.importer = Objects.requireNonNull(importer, "importer");
    }

    /** Service over the ledger named by {@code config}, writing with its compression and time zone. */
    public static LedgerService open(LedgerConfig config) {
        Objects.requireNonNull(config, "config");
        return open(config.requireLedgerFile(), Clock.systemUTC(), config.getTimeZone(), config.getCompressionLevel());
    }

    public static LedgerService open(Path ledgerPath) {
        return open(ledgerPath, Clock.systemUTC(), ZoneId.of("UTC"), Compression.DEFAULT_LEVEL);
    }

    public static LedgerService open(Path ledgerPath, Clock clock, ZoneId zone, int compressionLevel) {
        LedgerStore store = new LedgerStore(ledgerPath);
        return new LedgerService(
                store, new LedgerWriter(store, clock, zone, compressionLevel), new StatementImporter());
    }

    public Path getLedgerPath() {
        return store.getLedgerPath();
    }

    /** Current snapshot, parsing the file on first use and after every write. */
    public LedgerData readLedger() throws LedgerParseException {
        lock.lock();
        try {
            return store.get();
        } finally {
            lock.unlock();
        }
    }

    public WriteReceipt writeAccount(Account account, WriteMode mode) throws LedgerException {
        lock.lock();
        try {
            return writer.writeAccount(account, mode);
        } finally {
            lock.unlock();
        }
    }

    public WriteReceipt renameAccount(String accountId, String newName) throws LedgerException {
        lock.lock();
        try {
            return writer.renameAccount(accountId, newName);
        } finally {
            lock.unlock();
        }
    }

    public WriteReceipt writeTransaction(Transaction before, Transaction after, WriteMode mode)
            throws LedgerException {
        lock.lock();
        try {
            return writer.writeTransaction(before, after, mode);
        } finally {
            lock.unlock();
        }
    }

    public ImportResult parseImportFile(byte[] content, String filename, Integer headerRowOverride)
            throws ImportFormatException {
        return importer.parseImportFile(content, filename, headerRowOverride);
    }

    public List<ImportRow> parseImportFileWithMapping(byte[] content, ColumnMapping mapping)
            throws ImportFormatException {
        return importer.parseImportFileWithMapping(content, mapping);
    }

    public List<ImportRow> reconcileDuplicates(List<ImportRow> rows, LedgerData snapshot, String targetAccountId) {
        return DuplicateReconciler.reconcile(rows, snapshot, targetAccountId);
    }

    /**
     * Parses a statement and flags rows already in the book, against a snapshot read now. Results
     * that still need a column mapping are returned unchanged.
     */
    public ImportResult importStatement(
            byte[] content, String filename, Integer headerRowOverride, String targetAccountId)
            throws LedgerException {
        ImportResult result = parseImportFile(content, filename, headerRowOverride);
        if (result.isNeedsMapping()) {
            return result;
        }
        return result.withRows(reconcileDuplicates(result.getRows(), readLedger(), targetAccountId));
    }

    /**
     * Picks up changes made to the file by another program.
     *
     * @return true when the file had changed and the cache was refreshed
     */
    public boolean reload() throws LedgerParseException {
        lock.lock();
        try {
            return store.reloadIfChanged();
        } finally {
            lock.unlock();
        }
    }
}
