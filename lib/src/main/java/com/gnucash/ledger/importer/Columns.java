package com.gnucash.ledger.importer;

import java.util.List;
import java.util.regex.Pattern;

/** Header lookup and cell access shared by the layout matchers. */
final class Columns {

    private Columns() {}

    static Pattern pattern(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /** First header matching {@code pattern}, or -1. */
    static int indexOf(List<String> headers, Pattern pattern) {
        for (int i = 0; i < headers.size(); i++) {
            if (pattern.matcher(headers.get(i)).find()) {
                return i;
            }
        }
        return -1;
    }

    /** First header matching any of {@code patterns}, trying the patterns in order. */
    static int indexOfAny(List<String> headers, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            int index = indexOf(headers, pattern);
            if (index >= 0) {
                return index;
            }
        }
        return -1;
    }

    static boolean hasHeader(List<String> headers, Pattern pattern) {
        return indexOf(headers, pattern) >= 0;
    }

    /** Cell text, or "" when the column is absent or the row is short. */
    static String cell(List<String> row, int index) {
        if (index < 0 || index >= row.size()) {
            return "";
        }
        String value = row.get(index);
        return value == null ? "" : value;
    }

    static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
