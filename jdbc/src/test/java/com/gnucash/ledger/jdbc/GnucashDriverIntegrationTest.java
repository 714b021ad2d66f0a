package com.gnucash.ledger.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.gnucash.ledger.LedgerService;
import com.gnucash.ledger.jdbc.testing.TestLedgers;
import com.gnucash.ledger.ledger.Account;
import com.gnucash.ledger.ledger.AccountType;
import com.gnucash.ledger.ledger.LedgerData;
import com.gnucash.ledger.ledger.Split;
import com.gnucash.ledger.ledger.Transaction;
import com.gnucash.ledger.loader.LedgerParseException;
import com.gnucash.ledger.setup.NewLedgerFactory;
import com.gnucash.ledger.writer.WriteMode;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import org.apache.calcite.jdbc.CalciteConnection;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class GnucashDriverIntegrationTest {

    @TempDir
    Path tempDir;

    @BeforeAll
    static void loadDriver() throws Exception {
        Class.forName("com.gnucash.ledger.jdbc.GnucashDriver");
    }

    @Test
    void driverConnectsAndCountsRows() throws Exception {
        Path ledger = TestLedgers.sampleBook(tempDir);
        try (Connection connection = DriverManager.getConnection("jdbc:gnucash:" + ledger);
                Statement statement = connection.createStatement()) {
            assertEquals(8, count(statement, "SELECT COUNT(*) FROM accounts"));
            assertEquals(2, count(statement, "SELECT COUNT(*) FROM transactions"), "template transactions are hidden");
            assertEquals(4, count(statement, "SELECT COUNT(*) FROM \"gnucash\".\"splits\""));
        }
    }

    @Test
    void queriesUseTheLedgerReadAtConnectTime() throws Exception {
        Path ledger = TestLedgers.sampleBook(tempDir);
        try (Connection connection = DriverManager.getConnection("jdbc:gnucash:" + ledger);
                Statement statement = connection.createStatement()) {
            Files.delete(ledger);

            assertEquals(8, count(statement, "SELECT COUNT(*) FROM accounts"));
            assertEquals(4, count(statement, "SELECT COUNT(*) FROM splits"));
        }
    }

    @Test
    void splitsJoinToAccounts() throws Exception {
        Path ledger = TestLedgers.sampleBook(tempDir);
        String sql = "SELECT a.full_name, SUM(s.\"value\") AS total"
                + " FROM splits s JOIN accounts a ON s.account_id = a.id"
                + " GROUP BY a.full_name ORDER BY a.full_name";
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        try (Connection connection = DriverManager.getConnection("jdbc:gnucash:" + ledger);
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery(sql)) {
            while (rs.next()) {
                totals.put(rs.getString(1), rs.getBigDecimal(2));
            }
        }

        assertEquals(List.of("Assets:Checking", "Expenses:Groceries", "Income:Salary"), List.copyOf(totals.keySet()));
        assertEquals(0, new BigDecimal("1957.50").compareTo(totals.get("Assets:Checking")));
        assertEquals(0, new BigDecimal("-2000.00").compareTo(totals.get("Income:Salary")));
    }

    @Test
    void splitDetailsAreExposed() throws Exception {
        Path ledger = TestLedgers.sampleBook(tempDir);
        String sql = "SELECT id, date_posted, reconciled_state, reconcile_date, online_id, memo"
                + " FROM splits WHERE account_id = 'checking' ORDER BY date_posted";
        try (Connection connection = DriverManager.getConnection("jdbc:gnucash:" + ledger);
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery(sql)) {
            assertTrue(rs.next());
            assertEquals("split-tj-checking", rs.getString("id"));
            assertEquals("2024-01-15", rs.getString("date_posted"));
            assertEquals("c", rs.getString("reconciled_state"));
            assertNull(rs.getString("reconcile_date"));
            assertEquals("1234.000000", rs.getString("online_id"));
            assertNull(rs.getString("memo"));

            assertTrue(rs.next());
            assertEquals("split-pay-checking", rs.getString("id"));
            assertEquals("y", rs.getString("reconciled_state"));
            assertEquals("2024-02-05", rs.getString("reconcile_date"));
            assertFalse(rs.next());
        }
    }

    @Test
    void accountFlagsAndTransactionColumns() throws Exception {
        Path ledger = TestLedgers.sampleBook(tempDir);
        try (Connection connection = DriverManager.getConnection("jdbc:gnucash:" + ledger);
                Statement statement = connection.createStatement()) {
            try (ResultSet rs = statement.executeQuery(
                    "SELECT placeholder, parent_id FROM accounts WHERE id = 'assets'")) {
                assertTrue(rs.next());
                assertTrue(rs.getBoolean("placeholder"));
                assertEquals("root", rs.getString("parent_id"));
            }
            try (ResultSet rs = statement.executeQuery(
                    "SELECT num, split_count, date_posted, description FROM transactions WHERE id = 'txn-payroll'")) {
                assertTrue(rs.next());
                assertEquals("1001", rs.getString("num"));
                assertEquals(2, rs.getInt("split_count"));
                assertEquals("2024-01-31", rs.getString("date_posted"));
                assertEquals("Payroll", rs.getString("description"));
            }
        }
    }

    @Test
    void queriesSeeBooksWrittenByTheLibrary() throws Exception {
        Path ledger = new NewLedgerFactory().create(tempDir.resolve("new.gnucash"));
        LedgerService service = LedgerService.open(ledger);
        LedgerData created = service.readLedger();
        String checking = accountId(created, "Assets:Checking Account");
        String groceries = accountId(created, "Expenses:Groceries");
        service.writeAccount(
                Account.of("travel", "Travel", AccountType.EXPENSE, accountId(created, "Expenses"), "", false),
                WriteMode.CREATE);
        service.writeTransaction(
                null,
                Transaction.of(
                        "txn-1",
                        "Farmers market",
                        LocalDate.of(2024, 5, 4),
                        List.of(
                                Split.of("s-1", checking, new BigDecimal("-18.25"), ""),
                                Split.of("s-2", groceries, new BigDecimal("18.25"), "berries"))),
                WriteMode.CREATE);

        try (Connection connection = DriverManager.getConnection("jdbc:gnucash:" + ledger);
                Statement statement = connection.createStatement()) {
            assertEquals(19, count(statement, "SELECT COUNT(*) FROM accounts"));
            try (ResultSet rs = statement.executeQuery(
                    "SELECT account_name, memo FROM splits WHERE \"value\" > 0")) {
                assertTrue(rs.next());
                assertEquals("Expenses:Groceries", rs.getString("account_name"));
                assertEquals("berries", rs.getString("memo"));
                assertFalse(rs.next());
            }
        }
    }

    @Test
    void fileUriAndUrlParameters() throws Exception {
        Path ledger = TestLedgers.sampleBook(tempDir);
        String url = "jdbc:gnucash:" + ledger.toUri() + "?caseSensitive=true";
        try (Connection connection = DriverManager.getConnection(url);
                Statement statement = connection.createStatement()) {
            assertEquals(8, count(statement, "SELECT COUNT(*) FROM accounts"));
        }
    }

    @Test
    void metadataIdentifiesTheDriver() throws Exception {
        Path ledger = TestLedgers.sampleBook(tempDir);
        String url = "jdbc:gnucash:" + ledger;
        try (Connection connection = DriverManager.getConnection(url)) {
            DatabaseMetaData metaData = connection.getMetaData();

            assertEquals("GnuCash", metaData.getDatabaseProductName());
            assertEquals(Version.RUNTIME, metaData.getDriverVersion());
            assertEquals(url, metaData.getURL());
            assertTrue(connection.isReadOnly());
            assertNotNull(connection.unwrap(CalciteConnection.class).getRootSchema().getSubSchema("gnucash"));

            Set<String> tables = new TreeSet<>();
            try (ResultSet rs = metaData.getTables(null, "gnucash", "%", null)) {
                while (rs.next()) {
                    tables.add(rs.getString("TABLE_NAME"));
                }
            }
            assertEquals(Set.of("accounts", "splits", "transactions"), tables);
        }
    }

    @Test
    void missingOrCorruptLedgerFailsAtConnect() throws Exception {
        Path missing = tempDir.resolve("missing.gnucash");
        assertThrows(SQLException.class, () -> DriverManager.getConnection("jdbc:gnucash:" + missing));

        Path corrupt = Files.writeString(tempDir.resolve("plain.gnucash"), "<gnc-v2/>", StandardCharsets.UTF_8);
        SQLException ex = assertThrows(
                SQLException.class, () -> DriverManager.getConnection("jdbc:gnucash:" + corrupt));
        assertInstanceOf(LedgerParseException.class, ex.getCause());
    }

    @Test
    void foreignUrlsAreDeclined() throws Exception {
        GnucashDriver driver = new GnucashDriver();

        assertNull(driver.connect("jdbc:calcite:", new Properties()));
        assertFalse(driver.acceptsURL("jdbc:sqlite:/tmp/x"));
        assertEquals(Version.MAJOR, driver.getMajorVersion());
        assertEquals("ledger", driver.getPropertyInfo("jdbc:gnucash:", new Properties())[0].name);
    }

    private static int count(Statement statement, String sql) throws SQLException {
        try (ResultSet rs = statement.executeQuery(sql)) {
            assertTrue(rs.next());
            return rs.getInt(1);
        }
    }

    private static String accountId(LedgerData ledger, String fullName) {
        for (Account account : ledger.getAccounts()) {
            if (ledger.fullName(account.getId()).equals(fullName)) {
                return account.getId();
            }
        }
        throw new AssertionError("No account " + fullName);
    }
}
