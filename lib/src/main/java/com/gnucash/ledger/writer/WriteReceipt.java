package com.gnucash.ledger.writer;

import java.nio.file.Path;
import java.util.Objects;

/** Files produced by one successful write. */
public final class WriteReceipt {
    private final Path backupPath;
    private final Path auditLogPath;

    public WriteReceipt(Path backupPath, Path auditLogPath) {
        this.backupPath = Objects.requireNonNull(backupPath, "backupPath");
        this.auditLogPath = auditLogPath;
    }

    public Path getBackupPath() {
        return backupPath;
    }

    /** Transaction log, or null for account mutations. */
    public Path getAuditLogPath() {
        return auditLogPath;
    }

    @Override
    public String toString() {
        return "WriteReceipt{backup=" + backupPath + ", log=" + auditLogPath + "}";
    }
}
