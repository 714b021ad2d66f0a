package com.gnucash.ledger.importer;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Fallback column detection by header name. Each column has an ordered list of patterns; the
 * first pattern that matches any header wins.
 */
public final class GenericColumnMatcher {

    private static final List<Pattern> DATE = List.of(
            Columns.pattern("^date$"),
            Columns.pattern("transaction.?date"),
            Columns.pattern("posted"),
            Columns.pattern("run.?date"),
            Columns.pattern("date"));
    private static final List<Pattern> DESCRIPTION = List.of(
            Columns.pattern("description"),
            Columns.pattern("payee"),
            Columns.pattern("name"),
            Columns.pattern("memo"),
            Columns.pattern("narrative"));
    private static final List<Pattern> AMOUNT = List.of(
            Columns.pattern("^amount$"),
            Columns.pattern("debit.?credit"),
            Columns.pattern("credit"),
            Columns.pattern("debit"),
            Columns.pattern("amount"));
    private static final List<Pattern> MEMO = List.of(Columns.pattern("memo"), Columns.pattern("note"));

    private GenericColumnMatcher() {}

    /** Mapping for {@code headers}, or null unless date, description and amount are all found. */
    public static ColumnMapping match(List<String> headers) {
        int date = Columns.indexOfAny(headers, DATE);
        int description = Columns.indexOfAny(headers, DESCRIPTION);
        int amount = Columns.indexOfAny(headers, AMOUNT);
        if (date < 0 || description < 0 || amount < 0) {
            return null;
        }
        int memo = Columns.indexOfAny(headers, MEMO);
        return new ColumnMapping(date, description, amount, memo < 0 ? null : memo, false, null);
    }
}
