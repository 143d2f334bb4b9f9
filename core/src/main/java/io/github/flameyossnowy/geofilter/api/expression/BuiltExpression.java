package io.github.flameyossnowy.geofilter.api.expression;

import io.github.flameyossnowy.geofilter.api.layer.Dialect;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Output of an {@link ExpressionBuilder}: the expression plus human-readable notes on
 * the choices made while building it (source form, reprojection, centroid substitution).
 */
public record BuiltExpression(@NotNull Dialect dialect, @NotNull FilterExpression expression, @NotNull List<String> diagnostics) {
    public BuiltExpression {
        diagnostics = List.copyOf(diagnostics);
    }

    public String raw() {
        return expression.raw();
    }
}
