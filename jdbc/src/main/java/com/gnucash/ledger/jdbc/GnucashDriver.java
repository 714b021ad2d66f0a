package com.gnucash.ledger.jdbc;

import com.gnucash.ledger.jdbc.calcite.CalciteConnectionFactory;
import com.gnucash.ledger.ledger.LedgerData;
import com.gnucash.ledger.loader.LedgerParseException;
import com.gnucash.ledger.loader.LedgerReader;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC driver giving read-only SQL access to a GnuCash compressed XML book through Calcite. URLs
 * take the form {@code jdbc:gnucash:/path/to/book.gnucash} or {@code jdbc:gnucash:file:/...},
 * optionally followed by {@code ?key=value&...} connection properties.
 */
public final class GnucashDriver implements Driver {

    static final String URL_PREFIX = "jdbc:gnucash:";
    static final String LEDGER_PROPERTY = "ledger";
    private static final Logger LOGGER = Logger.getLogger(GnucashDriver.class.getName());

    static {
        try {
            DriverManager.registerDriver(new GnucashDriver());
        } catch (SQLException ex) {
            throw new ExceptionInInitializerError(ex);
        }
    }

    @Override
    public Connection connect(String url, Properties info) throws SQLException {
        if (!acceptsURL(url)) {
            return null;
        }
        ParsedUrl parsed = parseUrl(url);
        Properties properties = new Properties();
        if (info != null) {
            properties.putAll(info);
        }
        properties.putAll(parsed.properties());
        properties.setProperty(LEDGER_PROPERTY, parsed.ledgerPath().toString());

        // Fail at connect time rather than on the first query; the schema reuses this parse.
        LedgerData ledger;
        try {
            ledger = LedgerReader.read(parsed.ledgerPath());
        } catch (LedgerParseException ex) {
            throw new SQLException("Failed to load ledger: " + parsed.ledgerPath(), ex);
        }
        LOGGER.log(
                Level.FINE,
                "Opening {0} ({1} accounts, {2} transactions)",
                new Object[] {parsed.ledgerPath(), ledger.getAccounts().size(), ledger.getTransactions().size()});
        return wrapConnection(CalciteConnectionFactory.connect(parsed.ledgerPath(), ledger, properties), url);
    }

    @Override
    public boolean acceptsURL(String url) {
        return url != null && url.startsWith(URL_PREFIX);
    }

    @Override
    public DriverPropertyInfo[] getPropertyInfo(String url, Properties info) {
        DriverPropertyInfo ledgerProperty = new DriverPropertyInfo(LEDGER_PROPERTY, null);
        ledgerProperty.required = true;
        ledgerProperty.description = "Absolute or relative path to the GnuCash book.";
        return new DriverPropertyInfo[] {ledgerProperty};
    }

    @Override
    public int getMajorVersion() {
        return Version.MAJOR;
    }

    @Override
    public int getMinorVersion() {
        return Version.MINOR;
    }

    @Override
    public boolean jdbcCompliant() {
        return false;
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        throw new SQLFeatureNotSupportedException("Logging hierarchy not implemented.");
    }

    private static Connection wrapConnection(Connection delegate, String url) {
        return (Connection)
                Proxy.newProxyInstance(
                        Connection.class.getClassLoader(),
                        new Class<?>[] {Connection.class},
                        new DelegatingHandler(delegate) {
                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                return switch (method.getName()) {
                                    case "getMetaData" -> wrapMetaData(
                                            (DatabaseMetaData) super.handle(proxy, method, args), url);
                                    case "isReadOnly" -> Boolean.TRUE;
                                    default -> super.handle(proxy, method, args);
                                };
                            }
                        });
    }

    private static DatabaseMetaData wrapMetaData(DatabaseMetaData delegate, String url) {
        return (DatabaseMetaData)
                Proxy.newProxyInstance(
                        DatabaseMetaData.class.getClassLoader(),
                        new Class<?>[] {DatabaseMetaData.class},
                        new DelegatingHandler(delegate) {
                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                return switch (method.getName()) {
                                    case "getDatabaseProductName" -> "GnuCash";
                                    case "getDatabaseProductVersion", "getDriverVersion" -> Version.RUNTIME;
                                    case "getDriverName" -> "GnuCash JDBC Driver (Calcite)";
                                    case "getDriverMajorVersion" -> Version.MAJOR;
                                    case "getDriverMinorVersion" -> Version.MINOR;
                                    case "getURL" -> url;
                                    case "isReadOnly" -> Boolean.TRUE;
                                    default -> super.handle(proxy, method, args);
                                };
                            }
                        });
    }

    static ParsedUrl parseUrl(String url) throws SQLException {
        String remainder = url.substring(URL_PREFIX.length());
        if (remainder.isEmpty()) {
            throw new SQLException("Ledger path missing from JDBC URL.");
        }

        String ledgerSegment = remainder;
        Properties props = new Properties();
        int paramIndex = remainder.indexOf('?');
        if (paramIndex >= 0) {
            ledgerSegment = remainder.substring(0, paramIndex);
            for (String pair : remainder.substring(paramIndex + 1).split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                if (eq >= 0) {
                    props.setProperty(pair.substring(0, eq), pair.substring(eq + 1));
                } else {
                    props.setProperty(pair, "");
                }
            }
        }

        Path ledgerPath;
        if (ledgerSegment.startsWith("file:")) {
            try {
                ledgerPath = Paths.get(URI.create(ledgerSegment));
            } catch (IllegalArgumentException ex) {
                throw new SQLException("Invalid file URI in JDBC URL: " + ledgerSegment, ex);
            }
        } else {
            ledgerPath = Paths.get(ledgerSegment);
        }
        ledgerPath = ledgerPath.normalize();

        if (!Files.exists(ledgerPath)) {
            throw new SQLException("Ledger file not found: " + ledgerPath);
        }
        if (!Files.isReadable(ledgerPath)) {
            throw new SQLException("Ledger file is not readable: " + ledgerPath);
        }
        return new ParsedUrl(ledgerPath.toAbsolutePath(), props);
    }

    record ParsedUrl(Path ledgerPath, Properties properties) {}

    private abstract static class DelegatingHandler implements InvocationHandler {
        private final Object delegate;

        DelegatingHandler(Object delegate) {
            this.delegate = delegate;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            if (method.getDeclaringClass() == Object.class) {
                return method.invoke(delegate, args);
            }
            return handle(proxy, method, args);
        }

        Object handle(Object proxy, Method method, Object[] args) throws Throwable {
            try {
                return method.invoke(delegate, args);
            } catch (InvocationTargetException ex) {
                // callers expect the delegate's SQLException, not the reflection wrapper
                throw ex.getCause();
            }
        }
    }
}
