package com.gnucash.ledger.writer;

import com.gnucash.ledger.LedgerException;

/** A mutation would break referential integrity, e.g. deleting an account that splits still use. */
public final class ConstraintViolationException extends LedgerException {
    private final String entityId;

    public ConstraintViolationException(String entityId, String message) {
        super(message);
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
