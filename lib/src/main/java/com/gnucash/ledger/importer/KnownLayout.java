package com.gnucash.ledger.importer;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/** Export shapes of specific institutions, recognised by a distinctive pair of headers. */
public enum KnownLayout {

    /** Transaction Date, Post Date, Description, Category, Type, Amount, Memo. */
    CHASE("Chase") {
        @Override
        public boolean matches(List<String> headers) {
            return Columns.hasHeader(headers, TRANSACTION_DATE) && Columns.hasHeader(headers, DESCRIPTION);
        }

        @Override
        public ImportRow map(List<String> row, List<String> headers) {
            // the posting date is what the bank's own OFX download reports
            String posted = Columns.cell(row, Columns.indexOf(headers, POST_DATE));
            String date = posted.isEmpty() ? Columns.cell(row, Columns.indexOf(headers, TRANSACTION_DATE)) : posted;
            return row(
                    date,
                    Columns.cell(row, Columns.indexOf(headers, EXACT_AMOUNT)),
                    Columns.cell(row, Columns.indexOf(headers, DESCRIPTION)),
                    Columns.blankToNull(Columns.cell(row, Columns.indexOf(headers, MEMO))));
        }
    },

    /** Posted Date, Reference Number, Payee, Address, Amount. */
    BANK_OF_AMERICA("Bank of America") {
        @Override
        public boolean matches(List<String> headers) {
            return Columns.hasHeader(headers, POSTED_DATE) && Columns.hasHeader(headers, PAYEE);
        }

        @Override
        public ImportRow map(List<String> row, List<String> headers) {
            String description = Columns.cell(row, Columns.indexOf(headers, PAYEE));
            if (description.isEmpty()) {
                description = Columns.cell(row, Columns.indexOf(headers, DESCRIPTION));
            }
            return row(
                    Columns.cell(row, Columns.indexOf(headers, POSTED_DATE)),
                    Columns.cell(row, Columns.indexOf(headers, ANY_AMOUNT)),
                    description,
                    null);
        }
    },

    /** Run Date, Action, Symbol, Security Description, ..., Amount, Settlement Date. */
    FIDELITY("Fidelity") {
        @Override
        public boolean matches(List<String> headers) {
            return Columns.hasHeader(headers, RUN_DATE) && Columns.hasHeader(headers, ACTION);
        }

        @Override
        public ImportRow map(List<String> row, List<String> headers) {
            List<String> parts = new ArrayList<>(2);
            for (String part : List.of(
                    Columns.cell(row, Columns.indexOf(headers, ACTION)),
                    Columns.cell(row, Columns.indexOf(headers, SECURITY_DESCRIPTION)))) {
                if (!part.isEmpty()) {
                    parts.add(part);
                }
            }
            return row(
                    Columns.cell(row, Columns.indexOf(headers, RUN_DATE)),
                    Columns.cell(row, Columns.indexOf(headers, EXACT_AMOUNT)),
                    String.join(" ", parts),
                    Columns.blankToNull(Columns.cell(row, Columns.indexOf(headers, SYMBOL))));
        }
    };

    private static final Pattern TRANSACTION_DATE = Columns.pattern("transaction.?date");
    private static final Pattern POST_DATE = Columns.pattern("post.?date");
    private static final Pattern POSTED_DATE = Columns.pattern("posted.?date");
    private static final Pattern RUN_DATE = Columns.pattern("run.?date");
    private static final Pattern DESCRIPTION = Columns.pattern("description");
    private static final Pattern PAYEE = Columns.pattern("payee");
    private static final Pattern ACTION = Columns.pattern("action");
    private static final Pattern SECURITY_DESCRIPTION = Columns.pattern("security.?desc");
    private static final Pattern SYMBOL = Columns.pattern("symbol");
    private static final Pattern MEMO = Columns.pattern("memo");
    private static final Pattern EXACT_AMOUNT = Columns.pattern("^amount$");
    private static final Pattern ANY_AMOUNT = Columns.pattern("amount");

    private final String displayName;

    KnownLayout(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Whether {@code headers} has this layout's distinctive columns. */
    public abstract boolean matches(List<String> headers);

    /** Maps one data row, or returns null when its date or amount cannot be read. */
    public abstract ImportRow map(List<String> row, List<String> headers);

    /** First layout whose headers match, or null. */
    public static KnownLayout detect(List<String> headers) {
        for (KnownLayout layout : values()) {
            if (layout.matches(headers)) {
                return layout;
            }
        }
        return null;
    }

    private static ImportRow row(String rawDate, String rawAmount, String description, String memo) {
        LocalDate date = ImportDates.parse(rawDate);
        BigDecimal amount = AmountParser.parse(rawAmount);
        if (date == null || amount == null) {
            return null;
        }
        return new ImportRow(null, date, description, amount, memo);
    }
}
