package com.gnucash.ledger.audit;

/** Row marker of a GnuCash transaction log. */
public enum AuditMode {
    /** State before an edit. */
    B,
    /** State after an edit. */
    C,
    /** Newly created. */
    N,
    /** Deleted. */
    D
}
