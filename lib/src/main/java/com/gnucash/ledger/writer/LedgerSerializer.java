package com.gnucash.ledger.writer;

import com.gnucash.ledger.codec.FractionCodec;
import com.gnucash.ledger.ledger.Account;
import com.gnucash.ledger.ledger.Split;
import com.gnucash.ledger.ledger.Transaction;
import com.gnucash.ledger.loader.GncTags;
import com.gnucash.ledger.loader.XmlScanner;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Renders accounts and transactions as {@code gnc:account} / {@code gnc:transaction} blocks in
 * the element order GnuCash itself writes. Unrecognised slots are copied back verbatim.
 */
public final class LedgerSerializer {

    /** Time of day GnuCash attaches to date-only postings. */
    public static final String POSTED_TIME_SUFFIX = " 10:59:00 +0000";

    private static final String EPOCH_TIMESTAMP = "1970-01-01 00:00:00 +0000";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss Z");

    private LedgerSerializer() {}

    public static String gnucashDatetime(LocalDate date) {
        return date == null ? EPOCH_TIMESTAMP : date + POSTED_TIME_SUFFIX;
    }

    public static String serializeAccount(Account account) {
        Objects.requireNonNull(account, "account");
        StringBuilder xml = new StringBuilder(512);
        xml.append("<gnc:account version=\"2.0.0\">\n");
        element(xml, 1, GncTags.ACT_NAME, account.getName());
        guid(xml, 1, GncTags.ACT_ID, account.getId());
        element(xml, 1, GncTags.ACT_TYPE, account.getType().name());
        if (account.getCommodityId() != null) {
            open(xml, 1, GncTags.ACT_COMMODITY);
            element(xml, 2, GncTags.CMDTY_SPACE, orDefault(account.getCommoditySpace(), Account.DEFAULT_COMMODITY_SPACE));
            element(xml, 2, GncTags.CMDTY_ID, account.getCommodityId());
            close(xml, 1, GncTags.ACT_COMMODITY);
        }
        if (account.getCommodityScu() != null) {
            element(xml, 1, GncTags.ACT_COMMODITY_SCU, account.getCommodityScu().toString());
        }
        if (!account.getDescription().isEmpty()) {
            element(xml, 1, GncTags.ACT_DESCRIPTION, account.getDescription());
        }
        if (account.isPlaceholder() || account.isHidden() || !account.getExtraSlots().isEmpty()) {
            open(xml, 1, GncTags.ACT_SLOTS);
            if (account.isPlaceholder()) {
                stringSlot(xml, 2, GncTags.SLOT_PLACEHOLDER, "true");
            }
            if (account.isHidden()) {
                stringSlot(xml, 2, GncTags.SLOT_HIDDEN, "true");
            }
            rawSlots(xml, 2, account.getExtraSlots());
            close(xml, 1, GncTags.ACT_SLOTS);
        }
        if (account.getParentId() != null) {
            guid(xml, 1, GncTags.ACT_PARENT, account.getParentId());
        }
        xml.append("</gnc:account>");
        return xml.toString();
    }

    /**
     * Renders a transaction. A missing entry date is stamped with {@code now}, as GnuCash does when
     * it first saves a transaction.
     */
    public static String serializeTransaction(Transaction transaction, ZonedDateTime now) {
        Objects.requireNonNull(transaction, "transaction");
        Objects.requireNonNull(now, "now");
        StringBuilder xml = new StringBuilder(1024);
        xml.append("<gnc:transaction version=\"2.0.0\">\n");
        guid(xml, 1, GncTags.TRN_ID, transaction.getId());
        open(xml, 1, GncTags.TRN_CURRENCY);
        element(xml, 2, GncTags.CMDTY_SPACE, Account.DEFAULT_COMMODITY_SPACE);
        element(xml, 2, GncTags.CMDTY_ID, transaction.getCurrency());
        close(xml, 1, GncTags.TRN_CURRENCY);
        if (!transaction.getNum().isEmpty()) {
            element(xml, 1, GncTags.TRN_NUM, transaction.getNum());
        }
        timestamp(xml, 1, GncTags.TRN_DATE_POSTED, gnucashDatetime(transaction.getDatePosted()));
        String entered = transaction.getDateEntered() == null
                ? now.format(TIMESTAMP)
                : gnucashDatetime(transaction.getDateEntered());
        timestamp(xml, 1, GncTags.TRN_DATE_ENTERED, entered);
        element(xml, 1, GncTags.TRN_DESCRIPTION, transaction.getDescription());
        boolean hasSlots = transaction.getDatePosted() != null
                || !transaction.getNotes().isEmpty()
                || !transaction.getExtraSlots().isEmpty();
        if (hasSlots) {
            open(xml, 1, GncTags.TRN_SLOTS);
        }
        if (transaction.getDatePosted() != null) {
            indent(xml, 2).append("<slot>\n");
            element(xml, 3, "slot:key", GncTags.SLOT_DATE_POSTED);
            indent(xml, 3).append("<slot:value type=\"gdate\">\n");
            element(xml, 4, "gdate", transaction.getDatePosted().toString());
            indent(xml, 3).append("</slot:value>\n");
            indent(xml, 2).append("</slot>\n");
        }
        if (!transaction.getNotes().isEmpty()) {
            stringSlot(xml, 2, GncTags.SLOT_NOTES, transaction.getNotes());
        }
        rawSlots(xml, 2, transaction.getExtraSlots());
        if (hasSlots) {
            close(xml, 1, GncTags.TRN_SLOTS);
        }
        open(xml, 1, GncTags.TRN_SPLITS);
        for (Split split : transaction.getSplits()) {
            appendSplit(xml, split);
        }
        close(xml, 1, GncTags.TRN_SPLITS);
        xml.append("</gnc:transaction>");
        return xml.toString();
    }

    private static void appendSplit(StringBuilder xml, Split split) {
        open(xml, 2, GncTags.TRN_SPLIT);
        guid(xml, 3, GncTags.SPLIT_ID, split.getId());
        if (!split.getMemo().isEmpty()) {
            element(xml, 3, GncTags.SPLIT_MEMO, split.getMemo());
        }
        if (!split.getAction().isEmpty()) {
            element(xml, 3, GncTags.SPLIT_ACTION, split.getAction());
        }
        element(xml, 3, GncTags.SPLIT_RECONCILED_STATE, split.getReconciledState().toCode());
        if (split.getReconcileDate() != null) {
            timestamp(xml, 3, GncTags.SPLIT_RECONCILE_DATE, gnucashDatetime(split.getReconcileDate()));
        }
        element(xml, 3, GncTags.SPLIT_VALUE, FractionCodec.toFraction(split.getValue()));
        element(xml, 3, GncTags.SPLIT_QUANTITY, FractionCodec.toFraction(split.getQuantity()));
        guid(xml, 3, GncTags.SPLIT_ACCOUNT, split.getAccountId());
        if (split.getOnlineId() != null || !split.getExtraSlots().isEmpty()) {
            open(xml, 3, GncTags.SPLIT_SLOTS);
            if (split.getOnlineId() != null) {
                stringSlot(xml, 4, GncTags.SLOT_ONLINE_ID, split.getOnlineId());
            }
            rawSlots(xml, 4, split.getExtraSlots());
            close(xml, 3, GncTags.SPLIT_SLOTS);
        }
        close(xml, 2, GncTags.TRN_SPLIT);
    }

    private static void stringSlot(StringBuilder xml, int depth, String key, String value) {
        indent(xml, depth).append("<slot>\n");
        element(xml, depth + 1, "slot:key", key);
        indent(xml, depth + 1)
                .append("<slot:value type=\"string\">")
                .append(XmlScanner.escape(value))
                .append("</slot:value>\n");
        indent(xml, depth).append("</slot>\n");
    }

    private static void rawSlots(StringBuilder xml, int depth, Iterable<String> slots) {
        for (String slot : slots) {
            indent(xml, depth).append(slot).append('\n');
        }
    }

    private static void timestamp(StringBuilder xml, int depth, String name, String value) {
        open(xml, depth, name);
        element(xml, depth + 1, GncTags.TS_DATE, value);
        close(xml, depth, name);
    }

    private static void guid(StringBuilder xml, int depth, String name, String id) {
        indent(xml, depth)
                .append('<').append(name).append(" type=\"guid\">")
                .append(XmlScanner.escape(id))
                .append("</").append(name).append(">\n");
    }

    private static void element(StringBuilder xml, int depth, String name, String value) {
        indent(xml, depth)
                .append('<').append(name).append('>')
                .append(XmlScanner.escape(value))
                .append("</").append(name).append(">\n");
    }

    private static void open(StringBuilder xml, int depth, String name) {
        indent(xml, depth).append('<').append(name).append(">\n");
    }

    private static void close(StringBuilder xml, int depth, String name) {
        indent(xml, depth).append("</").append(name).append(">\n");
    }

    private static StringBuilder indent(StringBuilder xml, int depth) {
        for (int i = 0; i < depth; i++) {
            xml.append("  ");
        }
        return xml;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isEmpty() ? fallback : value;
    }
}
