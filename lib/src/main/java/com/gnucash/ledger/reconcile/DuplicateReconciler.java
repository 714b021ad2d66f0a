package com.gnucash.ledger.reconcile;

import com.gnucash.ledger.importer.ImportRow;
import com.gnucash.ledger.ledger.LedgerData;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Flags imported rows that are probably already in the book. A row is a duplicate when its
 * external id matches a split's online id, or when the fuzzy index has a split with the same
 * absolute amount within a day and a compatible description. Both false positives and misses are
 * possible; callers let the user override the flag.
 */
public final class DuplicateReconciler {

    private static final Logger LOGGER = Logger.getLogger(DuplicateReconciler.class.getName());

    private DuplicateReconciler() {}

    public static List<ImportRow> reconcile(List<ImportRow> rows, LedgerData ledger, String targetAccountId) {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(ledger, "ledger");
        DuplicateIndex index = DuplicateIndex.build(ledger, targetAccountId);
        List<ImportRow> annotated = new ArrayList<>(rows.size());
        int flagged = 0;
        for (ImportRow row : rows) {
            boolean duplicate = index.isDuplicate(row);
            if (duplicate) {
                flagged++;
            }
            annotated.add(row.withDuplicate(duplicate));
        }
        LOGGER.log(Level.FINE, "Flagged {0} of {1} imported rows as duplicates", new Object[] {flagged, rows.size()});
        return annotated;
    }
}
