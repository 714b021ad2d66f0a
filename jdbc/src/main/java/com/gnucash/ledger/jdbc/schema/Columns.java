package com.gnucash.ledger.jdbc.schema;

import java.sql.Types;
import java.time.LocalDate;

/** Column factories and value conversions shared by the ledger tables. */
final class Columns {

    private Columns() {}

    static ColumnDescriptor varchar(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.VARCHAR, "VARCHAR", 0, 0, nullable);
    }

    static ColumnDescriptor date(String name, boolean nullable) {
        return new ColumnDescriptor(name, Types.DATE, "DATE", 0, 0, nullable);
    }

    static ColumnDescriptor amount(String name) {
        return new ColumnDescriptor(name, Types.DECIMAL, "DECIMAL(16,2)", 16, 2, false);
    }

    static ColumnDescriptor integer(String name) {
        return new ColumnDescriptor(name, Types.INTEGER, "INTEGER", 10, 0, false);
    }

    static ColumnDescriptor bool(String name) {
        return new ColumnDescriptor(name, Types.BOOLEAN, "BOOLEAN", 0, 0, false);
    }

    static ColumnDescriptor flag(String name) {
        return new ColumnDescriptor(name, Types.CHAR, "CHAR", 1, 0, false);
    }

    /** Calcite holds DATE values as days since the epoch. */
    static Integer epochDay(LocalDate date) {
        return date == null ? null : Math.toIntExact(date.toEpochDay());
    }

    static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
