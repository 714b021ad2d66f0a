package com.gnucash.ledger.reconcile;

import java.util.regex.Pattern;

/** Normalization of bank transaction ids (OFX FITIDs and split {@code online_id} slots). */
public final class ExternalIds {

    // some exporters write numeric ids as "1234.000000"
    private static final Pattern ZERO_FRACTION = Pattern.compile("\\.0+$");

    private ExternalIds() {}

    /** Trimmed id without a trailing all-zero fraction; null when blank. */
    public static String normalize(String id) {
        if (id == null) {
            return null;
        }
        String normalized = ZERO_FRACTION.matcher(id.trim()).replaceFirst("");
        return normalized.isEmpty() ? null : normalized;
    }
}
