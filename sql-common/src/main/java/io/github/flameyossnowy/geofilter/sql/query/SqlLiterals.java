package io.github.flameyossnowy.geofilter.sql.query;

import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.StringJoiner;

public final class SqlLiterals {
    private SqlLiterals() {}

    public static String string(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Plain decimal notation, never exponent form: {@code 1.0E-4} renders as {@code 0.0001}.
     */
    public static String number(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Cannot render a non-finite number: " + value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    public static String value(@Nullable Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Double || value instanceof Float) {
            return number(((Number) value).doubleValue());
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Boolean bool) {
            return bool ? "TRUE" : "FALSE";
        }
        return string(value.toString());
    }

    public static String list(Collection<?> values) {
        StringJoiner joiner = new StringJoiner(", ", "(", ")");
        for (Object value : values) {
            joiner.add(value(value));
        }
        return joiner.toString();
    }
}
