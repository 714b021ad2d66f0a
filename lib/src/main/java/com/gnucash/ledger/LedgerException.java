package com.gnucash.ledger;

/**
 * Checked root of every failure the ledger core reports to its caller. Subclasses name the kind
 * of failure; the message names the operation and target id.
 */
public class LedgerException extends Exception {
    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
