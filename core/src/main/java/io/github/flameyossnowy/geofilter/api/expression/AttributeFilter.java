package io.github.flameyossnowy.geofilter.api.expression;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Attribute conditions ANDed with the spatial part of a filter.
 */
public record AttributeFilter(@NotNull List<AttributeCondition> conditions) {
    public AttributeFilter {
        conditions = List.copyOf(conditions);
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("An attribute filter needs at least one condition");
        }
    }

    public static AttributeFilter of(AttributeCondition... conditions) {
        return new AttributeFilter(List.of(conditions));
    }

    public boolean matches(@NotNull Map<String, ?> attributes) {
        for (AttributeCondition condition : conditions) {
            if (!condition.matches(attributes)) {
                return false;
            }
        }
        return true;
    }

    public List<String> fields() {
        List<String> fields = new ArrayList<>(conditions.size());
        for (AttributeCondition condition : conditions) {
            if (!fields.contains(condition.field())) {
                fields.add(condition.field());
            }
        }
        return fields;
    }
}
