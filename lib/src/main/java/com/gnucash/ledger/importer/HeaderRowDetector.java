package com.gnucash.ledger.importer;

import java.util.List;
import java.util.regex.Pattern;

/** Picks the header row of a delimited statement by counting cells that look like column titles. */
public final class HeaderRowDetector {

    /** Rows examined from the top of the file. */
    public static final int MAX_SCAN_ROWS = 20;

    /** A row scoring at least this is taken without looking further. */
    public static final int CONFIDENT_SCORE = 3;

    private static final Pattern KEYWORDS = Pattern.compile(
            "date|amount|debit|credit|payee|desc|memo|balance|reference|posting", Pattern.CASE_INSENSITIVE);

    private HeaderRowDetector() {}

    /** Number of cells in {@code row} containing a financial header keyword. */
    public static int score(List<String> row) {
        int score = 0;
        for (String cell : row) {
            if (cell != null && KEYWORDS.matcher(cell).find()) {
                score++;
            }
        }
        return score;
    }

    /**
     * Index of the best-scoring row among the first {@link #MAX_SCAN_ROWS} rows with at least two
     * cells. Ties go to the earlier row; 0 when nothing qualifies.
     */
    public static int detect(List<List<String>> rows) {
        int best = 0;
        int bestScore = -1;
        int limit = Math.min(MAX_SCAN_ROWS, rows.size());
        for (int i = 0; i < limit; i++) {
            List<String> row = rows.get(i);
            if (row.size() < 2) {
                continue;
            }
            int score = score(row);
            if (score > bestScore) {
                bestScore = score;
                best = i;
            }
            if (score >= CONFIDENT_SCORE) {
                break;
            }
        }
        return best;
    }
}
