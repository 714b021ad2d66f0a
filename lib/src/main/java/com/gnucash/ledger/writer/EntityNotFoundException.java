package com.gnucash.ledger.writer;

import com.gnucash.ledger.LedgerException;

/** An update or delete named an account or transaction id that is not in the book. */
public final class EntityNotFoundException extends LedgerException {
    private final String entityId;

    public EntityNotFoundException(String entityKind, String entityId, String operation) {
        super(entityKind + " " + entityId + " not found (" + operation + ")");
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}
