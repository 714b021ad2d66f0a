package com.gnucash.ledger.writer;

/** Kind of single-entity mutation applied to the book. */
public enum WriteMode {
    CREATE,
    UPDATE,
    DELETE
}
