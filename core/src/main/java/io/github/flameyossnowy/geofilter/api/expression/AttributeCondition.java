package io.github.flameyossnowy.geofilter.api.expression;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * {@code field operator value}. For {@link ComparisonOperator#IN} the value is a collection.
 */
public record AttributeCondition(@NotNull String field, @NotNull ComparisonOperator operator, @Nullable Object value) {
    public AttributeCondition {
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        if (operator == ComparisonOperator.IN && !(value instanceof Collection<?>)) {
            throw new IllegalArgumentException("IN requires a collection value for field " + field);
        }
        if (!operator.unary() && operator != ComparisonOperator.IN && value == null) {
            throw new IllegalArgumentException("Operator " + operator + " requires a value for field " + field);
        }
    }

    /**
     * Evaluates with SQL semantics: any comparison against a null attribute is false.
     */
    public boolean matches(@NotNull Map<String, ?> attributes) {
        Object actual = attributes.get(field);
        return switch (operator) {
            case IS_NULL -> actual == null;
            case IS_NOT_NULL -> actual != null;
            case IN -> actual != null && ((Collection<?>) value).stream().anyMatch(candidate -> compare(actual, candidate) == 0);
            case EQUALS -> actual != null && compare(actual, value) == 0;
            case NOT_EQUALS -> actual != null && compare(actual, value) != 0;
            case LESS_THAN -> actual != null && compare(actual, value) < 0;
            case LESS_OR_EQUAL -> actual != null && compare(actual, value) <= 0;
            case GREATER_THAN -> actual != null && compare(actual, value) > 0;
            case GREATER_OR_EQUAL -> actual != null && compare(actual, value) >= 0;
        };
    }

    private static int compare(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (actual instanceof Boolean a && expected instanceof Boolean b) {
            return Boolean.compare(a, b);
        }
        return String.valueOf(actual).compareTo(String.valueOf(expected));
    }
}
