package io.github.flameyossnowy.geofilter.api.expression;

import io.github.flameyossnowy.geofilter.api.buffer.BufferConfig;
import io.github.flameyossnowy.geofilter.api.layer.Dialect;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.predicate.CombineOperator;
import io.github.flameyossnowy.geofilter.api.predicate.PredicateSet;
import io.github.flameyossnowy.geofilter.api.source.SourceGeometryRef;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Turns a filter request into one expression valid in a single dialect.
 * Building is pure: no I/O, no shared state.
 */
public interface ExpressionBuilder {
    Dialect dialect();

    /**
     * @param source     source geometry reference, {@code null} only for attribute-only filters
     * @param predicates spatial predicates, possibly empty when an attribute filter is present
     * @throws io.github.flameyossnowy.geofilter.api.exceptions.UnsupportedFeatureException when the
     *         dialect cannot express the request natively
     */
    @NotNull
    BuiltExpression build(
        @Nullable SourceGeometryRef source,
        @NotNull PredicateSet predicates,
        @NotNull CombineOperator operator,
        @NotNull BufferConfig buffer,
        @NotNull LayerInfo target,
        @NotNull BuildOptions options
    );
}
