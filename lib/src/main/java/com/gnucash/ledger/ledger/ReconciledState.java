package com.gnucash.ledger.ledger;

/** Values of {@code split:reconciled-state}. */
public enum ReconciledState {
    NOT_RECONCILED('n'),
    CLEARED('c'),
    RECONCILED('y'),
    FROZEN('f'),
    VOIDED('v');

    private final char code;

    ReconciledState(char code) {
        this.code = code;
    }

    public char getCode() {
        return code;
    }

    public String toCode() {
        return String.valueOf(code);
    }

    /** Missing or unrecognised codes read as {@link #NOT_RECONCILED}. */
    public static ReconciledState fromCode(String text) {
        if (text == null || text.isBlank()) {
            return NOT_RECONCILED;
        }
        char c = Character.toLowerCase(text.trim().charAt(0));
        for (ReconciledState state : values()) {
            if (state.code == c) {
                return state;
            }
        }
        return NOT_RECONCILED;
    }
}
