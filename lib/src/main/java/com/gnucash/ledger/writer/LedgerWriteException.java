package com.gnucash.ledger.writer;

import com.gnucash.ledger.LedgerException;
import java.nio.file.Path;

/**
 * An I/O failure while backing up, rewriting or logging. When it happens after the backup step the
 * backup file named by {@link #getBackupPath()} holds the pre-write state.
 */
public final class LedgerWriteException extends LedgerException {
    private final transient Path backupPath;

    public LedgerWriteException(String message, Path backupPath, Throwable cause) {
        super(message, cause);
        this.backupPath = backupPath;
    }

    public Path getBackupPath() {
        return backupPath;
    }
}
