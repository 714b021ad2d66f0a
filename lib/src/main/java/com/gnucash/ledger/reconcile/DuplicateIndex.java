package com.gnucash.ledger.reconcile;

import com.gnucash.ledger.importer.ImportRow;
import com.gnucash.ledger.ledger.LedgerData;
import com.gnucash.ledger.ledger.Split;
import com.gnucash.ledger.ledger.Transaction;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lookup structures for spotting statement lines already in the book.
 *
 * <p>The exact index holds every normalized split online id. The fuzzy index is keyed by
 * {@code date|abs(amount)} and holds normalized description prefixes; each split is entered under
 * its transaction's posted date and the days either side, so a card's transaction date and posting
 * date still meet.</p>
 */
public final class DuplicateIndex {

    /** Characters of the normalized description that take part in fuzzy matching. */
    public static final int DESCRIPTION_PREFIX = 20;

    private final Set<String> externalIds;
    private final Map<String, Set<String>> fuzzy;

    private DuplicateIndex(Set<String> externalIds, Map<String, Set<String>> fuzzy) {
        this.externalIds = externalIds;
        this.fuzzy = fuzzy;
    }

    /**
     * @param targetAccountId account the statement belongs to; null enters every split in the fuzzy
     *     index
     */
    public static DuplicateIndex build(LedgerData ledger, String targetAccountId) {
        Set<String> externalIds = new HashSet<>();
        Map<String, Set<String>> fuzzy = new HashMap<>();
        for (Transaction transaction : ledger.getTransactions()) {
            String description = normalizeDescription(transaction.getDescription());
            for (Split split : transaction.getSplits()) {
                String id = ExternalIds.normalize(split.getOnlineId());
                if (id != null) {
                    externalIds.add(id);
                }
                LocalDate posted = transaction.getDatePosted();
                if (posted == null || (targetAccountId != null && !targetAccountId.equals(split.getAccountId()))) {
                    continue;
                }
                for (int offset = -1; offset <= 1; offset++) {
                    fuzzy.computeIfAbsent(fuzzyKey(posted.plusDays(offset), split.getValue()), key -> new HashSet<>())
                            .add(description);
                }
            }
        }
        return new DuplicateIndex(externalIds, fuzzy);
    }

    public boolean containsExternalId(String externalId) {
        String normalized = ExternalIds.normalize(externalId);
        return normalized != null && externalIds.contains(normalized);
    }

    /** Whether a split on {@code date} (give or take a day) for {@code |amount|} has a compatible description. */
    public boolean matchesFuzzy(LocalDate date, BigDecimal amount, String description) {
        Set<String> candidates = fuzzy.get(fuzzyKey(date, amount));
        if (candidates == null) {
            return false;
        }
        String normalized = normalizeDescription(description);
        for (String candidate : candidates) {
            if (prefixCompatible(candidate, normalized)) {
                return true;
            }
        }
        return false;
    }

    public boolean isDuplicate(ImportRow row) {
        return containsExternalId(row.getExternalId())
                || matchesFuzzy(row.getDate(), row.getAmount(), row.getDescription());
    }

    public static String fuzzyKey(LocalDate date, BigDecimal amount) {
        return date + "|" + amount.abs().setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    /** Lower-case letters and digits only, cut to {@link #DESCRIPTION_PREFIX} characters. */
    public static String normalizeDescription(String description) {
        if (description == null) {
            return "";
        }
        StringBuilder normalized = new StringBuilder(DESCRIPTION_PREFIX);
        String lower = description.toLowerCase(Locale.ROOT);
        for (int i = 0; i < lower.length() && normalized.length() < DESCRIPTION_PREFIX; i++) {
            char c = lower.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                normalized.append(c);
            }
        }
        return normalized.toString();
    }

    /** One is a prefix of the other; an empty description only matches another empty one. */
    static boolean prefixCompatible(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return a.isEmpty() && b.isEmpty();
        }
        return a.startsWith(b) || b.startsWith(a);
    }
}
