package com.gnucash.ledger.importer;

import com.gnucash.ledger.LedgerException;

/** The uploaded statement has an unsupported extension or an unreadable spreadsheet. */
public final class ImportFormatException extends LedgerException {
    public ImportFormatException(String message) {
        super(message);
    }

    public ImportFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
