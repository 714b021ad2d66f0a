package com.gnucash.ledger.loader;

import com.gnucash.ledger.LedgerException;

/** The ledger file could not be decompressed or does not have the expected book structure. */
public final class LedgerParseException extends LedgerException {
    public LedgerParseException(String message) {
        super(message);
    }

    public LedgerParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
