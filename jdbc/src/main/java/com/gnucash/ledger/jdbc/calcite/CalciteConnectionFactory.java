package com.gnucash.ledger.jdbc.calcite;

import com.gnucash.ledger.ledger.LedgerData;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;
import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.schema.SchemaPlus;

/** Opens Calcite connections with the GnuCash schema registered as the default schema. */
public final class CalciteConnectionFactory {

    public static final String SCHEMA_NAME = "gnucash";

    private CalciteConnectionFactory() {}

    /** Connects over a ledger that was already parsed from {@code ledgerPath}. */
    public static Connection connect(Path ledgerPath, LedgerData ledgerData, Properties properties)
            throws SQLException {
        Objects.requireNonNull(ledgerPath, "ledgerPath");
        Objects.requireNonNull(ledgerData, "ledgerData");
        Properties calciteProps = new Properties();
        if (properties != null) {
            calciteProps.putAll(properties);
        }
        setDefault(calciteProps, "lex", "JAVA");
        setDefault(calciteProps, "quoting", "DOUBLE_QUOTE");
        setDefault(calciteProps, "quotedCasing", "UNCHANGED");
        setDefault(calciteProps, "unquotedCasing", "UNCHANGED");
        setDefault(calciteProps, "caseSensitive", "true");
        setDefault(calciteProps, "conformance", "BABEL");

        Connection connection = DriverManager.getConnection("jdbc:calcite:", calciteProps);
        CalciteConnection calcite = connection.unwrap(CalciteConnection.class);
        SchemaPlus root = calcite.getRootSchema();
        root.add(
                SCHEMA_NAME,
                new GnucashSchema(root, SCHEMA_NAME, ledgerPath, ledgerData));
        calcite.setSchema(SCHEMA_NAME);
        return connection;
    }

    private static void setDefault(Properties properties, String key, String value) {
        if (!properties.containsKey(key)) {
            properties.setProperty(key, value);
        }
    }
}
