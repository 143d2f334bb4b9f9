package io.github.flameyossnowy.geofilter.api.expression;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * @param raw              filter text in the target's dialect
 * @param spatial          whether the text tests geometry at all
 * @param referencedFields target and source fields the text reads, as cataloged
 */
public record FilterExpression(@NotNull String raw, boolean spatial, @NotNull List<String> referencedFields) {
    public FilterExpression {
        Objects.requireNonNull(raw, "Expression text cannot be null");
        referencedFields = List.copyOf(referencedFields);
    }
}
