package com.gnucash.ledger.importer;

import java.util.ArrayList;
import java.util.List;

/**
 * Comma-delimited tokenizer. Quoted fields may contain commas and line breaks, {@code ""} inside
 * quotes is a literal quote, cells are trimmed, a leading byte-order mark is dropped and blank
 * lines are skipped.
 */
public final class CsvTokenizer {

    private static final char BOM = '\uFEFF';

    private CsvTokenizer() {}

    public static List<List<String>> tokenize(String text) {
        List<List<String>> rows = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return rows;
        }
        int start = text.charAt(0) == BOM ? 1 : 0;
        List<String> row = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        boolean sawDelimiter = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                if (quoted && i + 1 < text.length() && text.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else {
                    quoted = !quoted;
                }
            } else if (c == ',' && !quoted) {
                row.add(cell.toString().trim());
                cell.setLength(0);
                sawDelimiter = true;
            } else if ((c == '\n' || c == '\r') && !quoted) {
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                endRow(rows, row, cell, sawDelimiter);
                row = new ArrayList<>();
                cell.setLength(0);
                sawDelimiter = false;
            } else {
                cell.append(c);
            }
        }
        endRow(rows, row, cell, sawDelimiter);
        return rows;
    }

    private static void endRow(List<List<String>> rows, List<String> row, StringBuilder cell, boolean sawDelimiter) {
        String last = cell.toString().trim();
        if (!sawDelimiter && last.isEmpty()) {
            return;
        }
        row.add(last);
        rows.add(List.copyOf(row));
    }
}
