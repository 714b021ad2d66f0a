package com.gnucash.ledger.setup;

import com.gnucash.ledger.LedgerException;
import com.gnucash.ledger.ledger.Account;
import com.gnucash.ledger.ledger.AccountType;
import com.gnucash.ledger.loader.Compression;
import com.gnucash.ledger.writer.ConstraintViolationException;
import com.gnucash.ledger.writer.LedgerSerializer;
import com.gnucash.ledger.writer.LedgerWriteException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates an empty GnuCash book with a conventional starter chart of accounts: Assets,
 * Liabilities, Income, Expenses and Equity as placeholders with a few leaf accounts under each.
 */
public final class NewLedgerFactory {

    private static final Logger LOGGER = Logger.getLogger(NewLedgerFactory.class.getName());

    private static final String HEADER = "<?xml version=\"1.0\" encoding=\"utf-8\" ?>\n"
            + "<gnc-v2\n"
            + "     xmlns:gnc=\"http://www.gnucash.org/XML/gnc\"\n"
            + "     xmlns:act=\"http://www.gnucash.org/XML/act\"\n"
            + "     xmlns:book=\"http://www.gnucash.org/XML/book\"\n"
            + "     xmlns:cd=\"http://www.gnucash.org/XML/cd\"\n"
            + "     xmlns:cmdty=\"http://www.gnucash.org/XML/cmdty\"\n"
            + "     xmlns:price=\"http://www.gnucash.org/XML/price\"\n"
            + "     xmlns:slot=\"http://www.gnucash.org/XML/slot\"\n"
            + "     xmlns:split=\"http://www.gnucash.org/XML/split\"\n"
            + "     xmlns:trn=\"http://www.gnucash.org/XML/trn\"\n"
            + "     xmlns:ts=\"http://www.gnucash.org/XML/ts\">\n";

    private final Supplier<String> idGenerator;
    private final int compressionLevel;

    public NewLedgerFactory(Supplier<String> idGenerator, int compressionLevel) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
        this.compressionLevel = compressionLevel;
    }

    public NewLedgerFactory() {
        this(NewLedgerFactory::newGuid, Compression.DEFAULT_LEVEL);
    }

    /** 32 lower-case hex digits, the GUID form GnuCash writes. */
    public static String newGuid() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Writes a new compressed book at {@code path}.
     *
     * @throws ConstraintViolationException when {@code path} already exists
     */
    public Path create(Path path) throws LedgerException {
        Objects.requireNonNull(path, "path");
        if (Files.exists(path)) {
            throw new ConstraintViolationException(path.toString(), "Refusing to overwrite existing file " + path);
        }
        String xml = bookXml();
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, Compression.gzip(xml, compressionLevel), StandardOpenOption.CREATE_NEW);
        } catch (IOException ex) {
            throw new LedgerWriteException("Failed to create ledger " + path + ": " + ex.getMessage(), null, ex);
        }
        LOGGER.log(Level.INFO, "Created new ledger {0}", path);
        return path;
    }

    /** Accounts of the starter chart, root first, parents before children. */
    public List<Account> starterAccounts() {
        List<Account> accounts = new ArrayList<>();
        Account root = Account.of(idGenerator.get(), "Root Account", AccountType.ROOT, null, "", false);
        accounts.add(root);
        group(accounts, root, "Assets", AccountType.ASSET,
                leaf("Checking Account", AccountType.BANK),
                leaf("Savings Account", AccountType.BANK));
        group(accounts, root, "Liabilities", AccountType.LIABILITY,
                leaf("Credit Card", AccountType.CREDIT));
        group(accounts, root, "Income", AccountType.INCOME,
                leaf("Salary", AccountType.INCOME),
                leaf("Other Income", AccountType.INCOME));
        group(accounts, root, "Expenses", AccountType.EXPENSE,
                leaf("Groceries", AccountType.EXPENSE),
                leaf("Utilities", AccountType.EXPENSE),
                leaf("Housing", AccountType.EXPENSE),
                leaf("Transportation", AccountType.EXPENSE),
                leaf("Other Expenses", AccountType.EXPENSE));
        group(accounts, root, "Equity", AccountType.EQUITY,
                leaf("Opening Balances", AccountType.EQUITY),
                leaf("Imbalance-USD", AccountType.EQUITY));
        return accounts;
    }

    String bookXml() {
        List<Account> accounts = starterAccounts();
        StringBuilder xml = new StringBuilder(8192);
        xml.append(HEADER);
        xml.append("<gnc:count-data cd:type=\"book\">1</gnc:count-data>\n");
        xml.append("<gnc:book version=\"2.0.0\">\n");
        xml.append("<book:id type=\"guid\">").append(idGenerator.get()).append("</book:id>\n");
        xml.append("<book:slots>\n")
                .append("  <slot>\n")
                .append("    <slot:key>features</slot:key>\n")
                .append("    <slot:value type=\"frame\">\n")
                .append("      <slot>\n")
                .append("        <slot:key>Split/Order</slot:key>\n")
                .append("        <slot:value type=\"string\">1</slot:value>\n")
                .append("      </slot>\n")
                .append("    </slot:value>\n")
                .append("  </slot>\n")
                .append("</book:slots>\n");
        xml.append("<gnc:count-data cd:type=\"account\">").append(accounts.size()).append("</gnc:count-data>\n");
        xml.append("<gnc:count-data cd:type=\"transaction\">0</gnc:count-data>\n");
        for (Account account : accounts) {
            xml.append(LedgerSerializer.serializeAccount(account)).append('\n');
        }
        xml.append("</gnc:book>\n");
        xml.append("</gnc-v2>\n");
        return xml.toString();
    }

    private void group(List<Account> accounts, Account root, String name, AccountType type, Leaf... leaves) {
        Account group = Account.of(idGenerator.get(), name, type, root.getId(), "", true);
        accounts.add(group);
        for (Leaf leaf : leaves) {
            accounts.add(Account.of(idGenerator.get(), leaf.name, leaf.type, group.getId(), "", false));
        }
    }

    private static Leaf leaf(String name, AccountType type) {
        return new Leaf(name, type);
    }

    private static final class Leaf {
        private final String name;
        private final AccountType type;

        Leaf(String name, AccountType type) {
            this.name = name;
            this.type = type;
        }
    }
}
