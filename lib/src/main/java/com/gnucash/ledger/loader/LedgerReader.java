package com.gnucash.ledger.loader;

import com.gnucash.ledger.codec.FractionCodec;
import com.gnucash.ledger.ledger.Account;
import com.gnucash.ledger.ledger.AccountType;
import com.gnucash.ledger.ledger.LedgerData;
import com.gnucash.ledger.ledger.ReconciledState;
import com.gnucash.ledger.ledger.Split;
import com.gnucash.ledger.ledger.Transaction;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses a GnuCash XML v2 book into {@link LedgerData}. Only direct children of
 * {@code <gnc:book>} are read, so template transactions, prices and budgets are left alone.
 */
public final class LedgerReader {

    private static final Logger LOGGER = Logger.getLogger(LedgerReader.class.getName());

    private static final Set<String> ACCOUNT_SLOTS = Set.of(GncTags.SLOT_PLACEHOLDER, GncTags.SLOT_HIDDEN);
    private static final Set<String> TRANSACTION_SLOTS = Set.of(GncTags.SLOT_NOTES, GncTags.SLOT_DATE_POSTED);
    private static final Set<String> SPLIT_SLOTS = Set.of(GncTags.SLOT_ONLINE_ID);

    private LedgerReader() {}

    /** Reads, decompresses and parses the ledger at {@code ledgerPath}. */
    public static LedgerData read(Path ledgerPath) throws LedgerParseException {
        Objects.requireNonNull(ledgerPath, "ledgerPath");
        byte[] compressed;
        try {
            compressed = Files.readAllBytes(ledgerPath);
        } catch (IOException ex) {
            throw new LedgerParseException("Failed to read ledger " + ledgerPath + ": " + ex.getMessage(), ex);
        }
        return parse(Compression.gunzip(compressed));
    }

    /** Parses already-decompressed book text. */
    public static LedgerData parse(String xml) throws LedgerParseException {
        XmlElement book = findBook(xml);
        List<Account> accounts = new ArrayList<>();
        List<Transaction> transactions = new ArrayList<>();
        for (XmlElement element : XmlScanner.children(xml, book)) {
            switch (element.getName()) {
                case GncTags.ACCOUNT -> accounts.add(parseAccount(xml, element));
                case GncTags.TRANSACTION -> transactions.add(parseTransaction(xml, element));
                default -> {
                    // book:id, count-data, commodities, prices, templates, budgets: not modelled
                }
            }
        }
        checkParents(accounts);
        LOGGER.log(
                Level.FINE,
                "Parsed book with {0} accounts and {1} transactions",
                new Object[] {accounts.size(), transactions.size()});
        return new LedgerData(accounts, transactions);
    }

    /** Locates {@code <gnc:book>} under the {@code <gnc-v2>} root. */
    public static XmlElement findBook(String xml) throws LedgerParseException {
        for (XmlElement top : XmlScanner.children(xml)) {
            if (GncTags.BOOK.equals(top.getName())) {
                return top;
            }
            if (GncTags.ROOT.equals(top.getName())) {
                XmlElement book = XmlScanner.child(xml, top, GncTags.BOOK);
                if (book != null) {
                    return book;
                }
            }
        }
        throw new LedgerParseException("Ledger has no <" + GncTags.BOOK + "> element");
    }

    static Account parseAccount(String xml, XmlElement element) throws LedgerParseException {
        String id = required(xml, element, GncTags.ACT_ID, "account");
        String typeCode = required(xml, element, GncTags.ACT_TYPE, "account " + id);
        AccountType type = AccountType.fromCode(typeCode);
        if (type == null) {
            throw new LedgerParseException("Account " + id + " has unknown type '" + typeCode + "'");
        }
        String commoditySpace = null;
        String commodityId = null;
        XmlElement commodity = XmlScanner.child(xml, element, GncTags.ACT_COMMODITY);
        if (commodity != null) {
            commoditySpace = XmlScanner.childText(xml, commodity, GncTags.CMDTY_SPACE);
            commodityId = XmlScanner.childText(xml, commodity, GncTags.CMDTY_ID);
        }
        Integer scu = null;
        String scuText = XmlScanner.childText(xml, element, GncTags.ACT_COMMODITY_SCU);
        if (scuText != null && !scuText.isEmpty()) {
            try {
                scu = Integer.valueOf(scuText);
            } catch (NumberFormatException ex) {
                throw new LedgerParseException("Account " + id + " has malformed commodity-scu '" + scuText + "'", ex);
            }
        }
        SlotBlock slots = SlotBlock.read(xml, XmlScanner.child(xml, element, GncTags.ACT_SLOTS), ACCOUNT_SLOTS);
        return new Account(
                id,
                XmlScanner.childText(xml, element, GncTags.ACT_NAME),
                type,
                emptyToNull(XmlScanner.childText(xml, element, GncTags.ACT_PARENT)),
                XmlScanner.childText(xml, element, GncTags.ACT_DESCRIPTION),
                slots.isTrue(GncTags.SLOT_PLACEHOLDER),
                slots.isTrue(GncTags.SLOT_HIDDEN),
                commoditySpace,
                commodityId,
                scu,
                slots.extras());
    }

    static Transaction parseTransaction(String xml, XmlElement element) throws LedgerParseException {
        String id = required(xml, element, GncTags.TRN_ID, "transaction");
        String currency = null;
        XmlElement currencyElement = XmlScanner.child(xml, element, GncTags.TRN_CURRENCY);
        if (currencyElement != null) {
            currency = XmlScanner.childText(xml, currencyElement, GncTags.CMDTY_ID);
        }
        SlotBlock slots = SlotBlock.read(xml, XmlScanner.child(xml, element, GncTags.TRN_SLOTS), TRANSACTION_SLOTS);
        List<Split> splits = new ArrayList<>();
        XmlElement splitsElement = XmlScanner.child(xml, element, GncTags.TRN_SPLITS);
        if (splitsElement != null) {
            for (XmlElement split : XmlScanner.children(xml, splitsElement)) {
                if (GncTags.TRN_SPLIT.equals(split.getName())) {
                    splits.add(parseSplit(xml, split, id));
                }
            }
        }
        return new Transaction(
                id,
                XmlScanner.childText(xml, element, GncTags.TRN_DESCRIPTION),
                timestampDate(xml, element, GncTags.TRN_DATE_POSTED, id),
                timestampDate(xml, element, GncTags.TRN_DATE_ENTERED, id),
                slots.get(GncTags.SLOT_NOTES),
                currency,
                XmlScanner.childText(xml, element, GncTags.TRN_NUM),
                splits,
                slots.extras());
    }

    static Split parseSplit(String xml, XmlElement element, String transactionId) throws LedgerParseException {
        String id = required(xml, element, GncTags.SPLIT_ID, "split of transaction " + transactionId);
        String accountId = required(xml, element, GncTags.SPLIT_ACCOUNT, "split " + id);
        SlotBlock slots = SlotBlock.read(xml, XmlScanner.child(xml, element, GncTags.SPLIT_SLOTS), SPLIT_SLOTS);
        String onlineId = slots.get(GncTags.SLOT_ONLINE_ID);
        return new Split(
                id,
                accountId,
                amount(xml, element, GncTags.SPLIT_VALUE, id),
                amount(xml, element, GncTags.SPLIT_QUANTITY, id),
                ReconciledState.fromCode(XmlScanner.childText(xml, element, GncTags.SPLIT_RECONCILED_STATE)),
                timestampDate(xml, element, GncTags.SPLIT_RECONCILE_DATE, id),
                XmlScanner.childText(xml, element, GncTags.SPLIT_MEMO),
                XmlScanner.childText(xml, element, GncTags.SPLIT_ACTION),
                onlineId == null ? null : onlineId.trim(),
                slots.extras());
    }

    /** Parses the first ten characters of a {@code YYYY-MM-DD HH:MM:SS +ZZZZ} timestamp. */
    public static LocalDate parseDate(String timestamp) {
        if (timestamp == null) {
            return null;
        }
        String trimmed = timestamp.trim();
        if (trimmed.length() < 10) {
            return null;
        }
        return LocalDate.parse(trimmed.substring(0, 10));
    }

    private static LocalDate timestampDate(String xml, XmlElement parent, String wrapper, String ownerId)
            throws LedgerParseException {
        XmlElement element = XmlScanner.child(xml, parent, wrapper);
        if (element == null) {
            return null;
        }
        String value = XmlScanner.childText(xml, element, GncTags.TS_DATE);
        try {
            return parseDate(value);
        } catch (DateTimeParseException ex) {
            throw new LedgerParseException("Malformed " + wrapper + " '" + value + "' in " + ownerId, ex);
        }
    }

    private static BigDecimal amount(String xml, XmlElement parent, String name, String ownerId)
            throws LedgerParseException {
        String value = XmlScanner.childText(xml, parent, name);
        try {
            return FractionCodec.fromFraction(value);
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new LedgerParseException("Malformed " + name + " '" + value + "' in split " + ownerId, ex);
        }
    }

    private static String required(String xml, XmlElement parent, String name, String owner)
            throws LedgerParseException {
        String value = XmlScanner.childText(xml, parent, name);
        if (value == null || value.isEmpty()) {
            throw new LedgerParseException("Missing <" + name + "> in " + owner);
        }
        return value;
    }

    private static void checkParents(List<Account> accounts) throws LedgerParseException {
        Set<String> ids = new HashSet<>();
        for (Account account : accounts) {
            ids.add(account.getId());
        }
        for (Account account : accounts) {
            String parentId = account.getParentId();
            if (parentId != null && !ids.contains(parentId)) {
                throw new LedgerParseException(
                        "Account " + account.getId() + " references missing parent " + parentId);
            }
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
