package com.gnucash.ledger.writer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Names and creates the timestamped copies GnuCash keeps beside a book. Names have one-second
 * resolution, so two backups taken within the same second share a name and the later one wins.
 */
public final class BackupFiles {

    /** Extension used when the ledger file name has none. */
    public static final String DEFAULT_EXTENSION = "gnucash";

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private BackupFiles() {}

    public static String timestamp(Clock clock, ZoneId zone) {
        return ZonedDateTime.now(clock.withZone(zone)).format(STAMP);
    }

    /** {@code <ledger>.<timestamp>.<ledger extension>} in the ledger's directory. */
    public static Path backupPath(Path ledgerPath, String timestamp) {
        String fileName = ledgerPath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String extension = dot > 0 && dot < fileName.length() - 1 ? fileName.substring(dot + 1) : DEFAULT_EXTENSION;
        return ledgerPath.resolveSibling(fileName + "." + timestamp + "." + extension);
    }

    /** Copies the compressed ledger byte for byte. */
    public static Path backup(Path ledgerPath, String timestamp) throws IOException {
        Path target = backupPath(ledgerPath, timestamp);
        Files.copy(ledgerPath, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        return target;
    }
}
