package io.github.flameyossnowy.geofilter.api.predicate;

import java.util.Locale;

public enum CombineOperator {
    AND,
    OR;

    public String sql() {
        return " " + name() + " ";
    }

    public static CombineOperator parse(String operator) {
        if (operator == null || operator.isBlank()) {
            return AND;
        }
        return valueOf(operator.trim().toUpperCase(Locale.ROOT));
    }
}
