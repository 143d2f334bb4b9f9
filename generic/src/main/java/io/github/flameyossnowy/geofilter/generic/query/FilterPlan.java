package io.github.flameyossnowy.geofilter.generic.query;

import io.github.flameyossnowy.geofilter.api.buffer.EndCapStyle;
import io.github.flameyossnowy.geofilter.api.buffer.JoinStyle;
import io.github.flameyossnowy.geofilter.api.expression.CentroidMode;
import io.github.flameyossnowy.geofilter.api.expression.ComparisonOperator;
import io.github.flameyossnowy.geofilter.api.predicate.CombineOperator;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Serialized form of a generic-format filter. File-backed layers have no query language the
 * engine can rely on, so the built expression is this plan as JSON and the executor evaluates
 * it in-process.
 *
 * @param sourceWkt         combined source geometry, {@code null} for attribute-only plans
 * @param sourceSrid        CRS of the source geometry
 * @param sourceFeatures    individual source features, present only for per-feature buffers
 * @param targetSrid        CRS of the target layer
 * @param predicates        canonical predicate names in selectivity order
 * @param operator          how the predicate tests combine
 * @param buffer            buffer to apply to the source, {@code null} when none
 * @param simplifyTolerance tolerance to simplify the source with before buffering, {@code 0} for none
 * @param centroidMode      centroid substituted for target geometries, {@code null} to test full geometries
 * @param metricSrid        projected CRS geographic sources are buffered in
 * @param conditions        attribute conditions ANDed with the spatial tests
 */
public record FilterPlan(
    @Nullable String sourceWkt,
    int sourceSrid,
    @Nullable List<PlanFeature> sourceFeatures,
    int targetSrid,
    List<String> predicates,
    CombineOperator operator,
    @Nullable PlanBuffer buffer,
    double simplifyTolerance,
    @Nullable CentroidMode centroidMode,
    int metricSrid,
    List<PlanCondition> conditions
) {
    public FilterPlan {
        predicates = predicates == null ? List.of() : List.copyOf(predicates);
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public boolean spatial() {
        return sourceWkt != null && !predicates.isEmpty();
    }

    public record PlanFeature(String wkt, Map<String, Object> attributes) {}

    /**
     * @param distance   fixed distance, {@code 0} when {@code expression} drives the buffer
     * @param expression per-feature distance expression
     */
    public record PlanBuffer(double distance, @Nullable String expression, int segments, EndCapStyle endCapStyle, JoinStyle joinStyle) {}

    public record PlanCondition(String field, ComparisonOperator operator, @Nullable Object value) {}
}
