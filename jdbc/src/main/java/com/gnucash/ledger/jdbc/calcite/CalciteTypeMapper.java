package com.gnucash.ledger.jdbc.calcite;

import com.gnucash.ledger.jdbc.schema.ColumnDescriptor;
import java.sql.Types;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.sql.type.SqlTypeName;

final class CalciteTypeMapper {

    private CalciteTypeMapper() {}

    static RelDataType toRelDataType(RelDataTypeFactory factory, ColumnDescriptor column) {
        SqlTypeName sqlType = mapSqlType(column.getJdbcType());
        RelDataType baseType;
        if (sqlType == SqlTypeName.DECIMAL && column.getSize() > 0) {
            baseType = factory.createSqlType(sqlType, column.getSize(), Math.max(0, column.getScale()));
        } else if (column.getSize() > 0 && sqlType.allowsPrec()) {
            baseType = factory.createSqlType(sqlType, column.getSize());
        } else {
            baseType = factory.createSqlType(sqlType);
        }
        return column.isNullable() ? factory.createTypeWithNullability(baseType, true) : baseType;
    }

    static SqlTypeName mapSqlType(int jdbcType) {
        return switch (jdbcType) {
            case Types.INTEGER -> SqlTypeName.INTEGER;
            case Types.BIGINT -> SqlTypeName.BIGINT;
            case Types.DECIMAL, Types.NUMERIC -> SqlTypeName.DECIMAL;
            case Types.DATE -> SqlTypeName.DATE;
            case Types.CHAR -> SqlTypeName.CHAR;
            case Types.VARCHAR -> SqlTypeName.VARCHAR;
            case Types.BOOLEAN -> SqlTypeName.BOOLEAN;
            case Types.DOUBLE -> SqlTypeName.DOUBLE;
            default -> SqlTypeName.ANY;
        };
    }
}
