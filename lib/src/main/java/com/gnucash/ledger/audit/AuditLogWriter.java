package com.gnucash.ledger.audit;

import com.gnucash.ledger.codec.FractionCodec;
import com.gnucash.ledger.ledger.Account;
import com.gnucash.ledger.ledger.Split;
import com.gnucash.ledger.ledger.Transaction;
import com.gnucash.ledger.writer.WriteMode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the tab-delimited {@code .log} file GnuCash keeps next to a book, one row per split of
 * the transaction that changed.
 */
public final class AuditLogWriter {

    public static final String HEADER =
            "mod\ttrans_guid\tsplit_guid\ttime_now\tdate_entered\tdate_posted\t"
                    + "acc_guid\tacc_name\tnum\tdescription\tnotes\tmemo\taction\t"
                    + "reconciled\tamount\tvalue\tdate_reconciled";
    public static final String RULE = "-----------------";
    public static final String START = "===== START";
    public static final String END = "===== END";

    private static final String NO_RECONCILE_DATE = "1970-01-01";

    private AuditLogWriter() {}

    /** {@code <ledger>.<timestamp>.log} in the ledger's directory. */
    public static Path logPath(Path ledgerPath, String timestamp) {
        return ledgerPath.resolveSibling(ledgerPath.getFileName() + "." + timestamp + ".log");
    }

    /**
     * Renders the log for one transaction mutation.
     *
     * @param timeNow wall-clock time as {@code yyyy-MM-dd HH:mm:ss}
     * @param accounts account lookup used for the {@code acc_name} column
     */
    public static String render(
            WriteMode mode, Transaction before, Transaction after, Map<String, Account> accounts, String timeNow) {
        Objects.requireNonNull(mode, "mode");
        List<String> lines = new ArrayList<>();
        lines.add(HEADER);
        lines.add(RULE);
        lines.add(START);
        switch (mode) {
            case DELETE -> appendRows(lines, AuditMode.D, Objects.requireNonNull(before, "before"), accounts, timeNow);
            case CREATE -> appendRows(lines, AuditMode.N, Objects.requireNonNull(after, "after"), accounts, timeNow);
            case UPDATE -> {
                appendRows(lines, AuditMode.B, before == null ? after : before, accounts, timeNow);
                appendRows(lines, AuditMode.C, Objects.requireNonNull(after, "after"), accounts, timeNow);
            }
        }
        lines.add(END);
        return String.join("\n", lines) + "\n";
    }

    public static Path write(Path logPath, String content) throws IOException {
        return Files.writeString(logPath, content, StandardCharsets.UTF_8);
    }

    static String row(AuditMode mode, Transaction transaction, Split split, Map<String, Account> accounts, String timeNow) {
        Account account = accounts == null ? null : accounts.get(split.getAccountId());
        LocalDate posted = transaction.getDatePosted();
        LocalDate entered = transaction.getDateEntered() == null ? posted : transaction.getDateEntered();
        String value = FractionCodec.toFraction(split.getValue());
        List<String> fields = List.of(
                mode.name(),
                field(transaction.getId()),
                field(split.getId()),
                timeNow,
                date(entered),
                date(posted),
                field(split.getAccountId()),
                account == null ? "" : field(account.getName()),
                "",
                field(transaction.getDescription()),
                field(transaction.getNotes()),
                field(split.getMemo()),
                field(split.getAction()),
                split.getReconciledState().toCode(),
                value,
                value,
                split.getReconcileDate() == null ? NO_RECONCILE_DATE : split.getReconcileDate().toString());
        return String.join("\t", fields);
    }

    private static void appendRows(
            List<String> lines, AuditMode mode, Transaction transaction, Map<String, Account> accounts, String timeNow) {
        for (Split split : transaction.getSplits()) {
            lines.add(row(mode, transaction, split, accounts, timeNow));
        }
    }

    private static String date(LocalDate date) {
        return date == null ? "" : date.toString();
    }

    /** Tabs and line breaks would shift columns; flatten them to spaces. */
    private static String field(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\r\n", " ").replace('\t', ' ').replace('\n', ' ').replace('\r', ' ');
    }
}
