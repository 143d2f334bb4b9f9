package io.github.flameyossnowy.geofilter.sql.query;

import io.github.flameyossnowy.geofilter.api.expression.AttributeCondition;
import io.github.flameyossnowy.geofilter.api.expression.AttributeFilter;
import io.github.flameyossnowy.geofilter.api.expression.ComparisonOperator;

import java.util.Collection;
import java.util.StringJoiner;

public final class SqlAttributeRenderer {
    private SqlAttributeRenderer() {}

    public static String render(AttributeFilter filter) {
        if (filter.conditions().size() == 1) {
            return render(filter.conditions().get(0));
        }

        StringJoiner joiner = new StringJoiner(" AND ");
        for (AttributeCondition condition : filter.conditions()) {
            joiner.add("(" + render(condition) + ")");
        }
        return joiner.toString();
    }

    public static String render(AttributeCondition condition) {
        String column = SqlIdentifiers.quote(condition.field());
        ComparisonOperator operator = condition.operator();

        if (operator.unary()) {
            return column + " " + operator.sql();
        }

        if (operator == ComparisonOperator.IN) {
            Collection<?> values = (Collection<?>) condition.value();
            if (values.isEmpty()) {
                return "1 = 0";
            }
            return column + " IN " + SqlLiterals.list(values);
        }

        return column + " " + operator.sql() + " " + SqlLiterals.value(condition.value());
    }
}
