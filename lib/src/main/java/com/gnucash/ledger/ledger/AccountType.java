package com.gnucash.ledger.ledger;

import java.util.Locale;

/** Account types as spelled in {@code act:type}. */
public enum AccountType {
    ROOT,
    BANK,
    CASH,
    ASSET,
    STOCK,
    MUTUAL,
    CURRENCY,
    RECEIVABLE,
    TRADING,
    CREDIT,
    LIABILITY,
    PAYABLE,
    INCOME,
    EXPENSE,
    EQUITY;

    /** Looks up a type by its file spelling, case-insensitively; returns null when unknown. */
    public static AccountType fromCode(String code) {
        if (code == null) {
            return null;
        }
        try {
            return valueOf(code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }
}
