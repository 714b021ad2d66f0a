package com.gnucash.ledger.writer;

import com.gnucash.ledger.LedgerException;
import com.gnucash.ledger.audit.AuditLogWriter;
import com.gnucash.ledger.ledger.Account;
import com.gnucash.ledger.ledger.LedgerData;
import com.gnucash.ledger.ledger.Transaction;
import com.gnucash.ledger.loader.Compression;
import com.gnucash.ledger.loader.GncTags;
import com.gnucash.ledger.loader.LedgerStore;
import com.gnucash.ledger.loader.XmlElement;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies one account or transaction mutation to the ledger file behind a {@link LedgerStore}.
 *
 * <p>Every call first copies the compressed file to a timestamped backup, then patches the cached
 * book text block by block, adjusts the count-data counters, recompresses to a temporary sibling
 * and moves it over the live file. Transaction mutations also leave a GnuCash-style audit log.
 * When a check fails the live file is not touched; the backup is kept regardless.</p>
 */
public final class LedgerWriter {

    private static final Logger LOGGER = Logger.getLogger(LedgerWriter.class.getName());
    private static final DateTimeFormatter LOG_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final LedgerStore store;
    private final Clock clock;
    private final ZoneId zone;
    private final int compressionLevel;

    public LedgerWriter(LedgerStore store, Clock clock, ZoneId zone, int compressionLevel) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.zone = Objects.requireNonNull(zone, "zone");
        if (compressionLevel < 0 || compressionLevel > 9) {
            throw new IllegalArgumentException("compressionLevel must be between 0 and 9: " + compressionLevel);
        }
        this.compressionLevel = compressionLevel;
    }

    public LedgerWriter(LedgerStore store) {
        this(store, Clock.systemUTC(), ZoneId.of("UTC"), Compression.DEFAULT_LEVEL);
    }

    public WriteReceipt writeAccount(Account account, WriteMode mode) throws LedgerException {
        Objects.requireNonNull(account, "account");
        Objects.requireNonNull(mode, "mode");
        String operation = mode.name().toLowerCase(Locale.ROOT) + " account";
        String timestamp = BackupFiles.timestamp(clock, zone);
        Path backup = backup(timestamp, operation, account.getId());
        String xml = store.rawText();
        XmlElement existing = BlockEditor.findAccount(xml, account.getId());
        String updated;
        switch (mode) {
            case CREATE -> {
                if (existing != null) {
                    throw new ConstraintViolationException(account.getId(), "Account " + account.getId() + " already exists");
                }
                checkParent(store.get(), account, operation);
                updated = BlockEditor.insertAccount(xml, LedgerSerializer.serializeAccount(account));
                updated = BlockEditor.adjustCount(updated, GncTags.COUNT_ACCOUNT, 1);
            }
            case UPDATE -> {
                requirePresent(existing, "Account", account.getId(), operation);
                checkParent(store.get(), account, operation);
                updated = BlockEditor.replace(xml, existing, LedgerSerializer.serializeAccount(account));
            }
            case DELETE -> {
                requirePresent(existing, "Account", account.getId(), operation);
                checkDeletable(store.get(), account.getId());
                updated = BlockEditor.remove(xml, existing);
                updated = BlockEditor.adjustCount(updated, GncTags.COUNT_ACCOUNT, -1);
            }
            default -> throw new IllegalStateException("Unexpected mode " + mode);
        }
        persist(updated, backup);
        LOGGER.log(Level.INFO, "Applied {0} {1}; backup {2}", new Object[] {operation, account.getId(), backup});
        return new WriteReceipt(backup, null);
    }

    public WriteReceipt renameAccount(String accountId, String newName) throws LedgerException {
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(newName, "newName");
        String timestamp = BackupFiles.timestamp(clock, zone);
        Path backup = backup(timestamp, "rename account", accountId);
        String xml = store.rawText();
        XmlElement existing = BlockEditor.findAccount(xml, accountId);
        requirePresent(existing, "Account", accountId, "rename account");
        persist(BlockEditor.renameAccount(xml, existing, newName), backup);
        LOGGER.log(Level.INFO, "Renamed account {0} to {1}", new Object[] {accountId, newName});
        return new WriteReceipt(backup, null);
    }

    /**
     * Creates, updates or deletes one transaction. {@code before} feeds the audit log and, for
     * deletes, names the transaction to remove; when it is null the stored version is used.
     */
    public WriteReceipt writeTransaction(Transaction before, Transaction after, WriteMode mode)
            throws LedgerException {
        Objects.requireNonNull(mode, "mode");
        Transaction subject = mode == WriteMode.DELETE && before != null ? before : after;
        if (subject == null) {
            throw new IllegalArgumentException("A transaction is required for " + mode);
        }
        String id = subject.getId();
        String operation = mode.name().toLowerCase(Locale.ROOT) + " transaction";
        String timestamp = BackupFiles.timestamp(clock, zone);
        Path backup = backup(timestamp, operation, id);
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        LedgerData ledger = store.get();
        String xml = store.rawText();
        XmlElement existing = BlockEditor.findTransaction(xml, id);
        Transaction stored = ledger.findTransaction(id).orElse(null);
        Transaction logBefore = before;
        Transaction logAfter = after;
        String updated;
        switch (mode) {
            case CREATE -> {
                if (existing != null) {
                    throw new ConstraintViolationException(id, "Transaction " + id + " already exists");
                }
                updated = BlockEditor.insertTransaction(xml, LedgerSerializer.serializeTransaction(after, now));
                updated = BlockEditor.adjustCount(updated, GncTags.COUNT_TRANSACTION, 1);
            }
            case UPDATE -> {
                requirePresent(existing, "Transaction", id, operation);
                updated = BlockEditor.replace(xml, existing, LedgerSerializer.serializeTransaction(after, now));
                if (logBefore == null) {
                    logBefore = stored;
                }
            }
            case DELETE -> {
                requirePresent(existing, "Transaction", id, operation);
                updated = BlockEditor.remove(xml, existing);
                updated = BlockEditor.adjustCount(updated, GncTags.COUNT_TRANSACTION, -1);
                logBefore = stored == null ? subject : stored;
                logAfter = null;
            }
            default -> throw new IllegalStateException("Unexpected mode " + mode);
        }
        persist(updated, backup);
        Path logPath = AuditLogWriter.logPath(store.getLedgerPath(), timestamp);
        String log = AuditLogWriter.render(mode, logBefore, logAfter, ledger.getAccountsById(), now.format(LOG_TIME));
        try {
            AuditLogWriter.write(logPath, log);
        } catch (IOException ex) {
            throw new LedgerWriteException(
                    "Ledger saved but audit log " + logPath + " could not be written: " + ex.getMessage(), backup, ex);
        }
        LOGGER.log(Level.INFO, "Applied {0} {1}; backup {2}", new Object[] {operation, id, backup});
        return new WriteReceipt(backup, logPath);
    }

    private Path backup(String timestamp, String operation, String id) throws LedgerException {
        Path ledgerPath = store.getLedgerPath();
        Path backup;
        try {
            backup = BackupFiles.backup(ledgerPath, timestamp);
        } catch (IOException ex) {
            throw new LedgerWriteException(
                    "Could not back up " + ledgerPath + " before " + operation + " " + id + ": " + ex.getMessage(),
                    null,
                    ex);
        }
        LOGGER.log(Level.FINE, "Backed up {0} to {1}", new Object[] {ledgerPath, backup});
        // the cache must describe exactly the bytes that were just backed up
        store.reloadIfChanged();
        return backup;
    }

    private void persist(String xml, Path backup) throws LedgerWriteException {
        Path ledgerPath = store.getLedgerPath();
        Path temp = ledgerPath.resolveSibling(ledgerPath.getFileName() + ".tmp");
        byte[] compressed;
        try {
            compressed = Compression.gzip(xml, compressionLevel);
            Files.write(temp, compressed);
            move(temp, ledgerPath);
        } catch (IOException ex) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                ex.addSuppressed(cleanup);
            }
            throw new LedgerWriteException(
                    "Failed to write " + ledgerPath + "; previous content is in " + backup + ": " + ex.getMessage(),
                    backup,
                    ex);
        }
        store.replaceRawText(xml, compressed);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            LOGGER.log(Level.FINE, "Atomic move unsupported for {0}; falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void requirePresent(XmlElement block, String kind, String id, String operation)
            throws EntityNotFoundException {
        if (block == null) {
            throw new EntityNotFoundException(kind, id, operation);
        }
    }

    /** The parent must exist and must not be the account itself or one of its descendants. */
    private static void checkParent(LedgerData ledger, Account account, String operation) throws LedgerException {
        String parentId = account.getParentId();
        if (parentId == null) {
            return;
        }
        if (ledger.findAccount(parentId).isEmpty()) {
            throw new EntityNotFoundException("Parent account", parentId, operation);
        }
        String current = parentId;
        for (int steps = 0; current != null && steps <= ledger.getAccounts().size(); steps++) {
            if (current.equals(account.getId())) {
                throw new ConstraintViolationException(
                        account.getId(),
                        "Account " + account.getId() + " cannot be placed under " + parentId
                                + " because that would create a cycle");
            }
            current = ledger.findAccount(current).map(Account::getParentId).orElse(null);
        }
    }

    private static void checkDeletable(LedgerData ledger, String accountId) throws ConstraintViolationException {
        if (ledger.isAccountInUse(accountId)) {
            throw new ConstraintViolationException(
                    accountId,
                    "Cannot delete account " + accountId
                            + " while transactions reference it; remove or reassign them first");
        }
        for (Account candidate : ledger.getAccounts()) {
            if (accountId.equals(candidate.getParentId())) {
                throw new ConstraintViolationException(
                        accountId, "Cannot delete account " + accountId + " while it has child accounts");
            }
        }
    }
}
