package io.github.flameyossnowy.geofilter.generic.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.flameyossnowy.geofilter.api.buffer.BufferConfig;
import io.github.flameyossnowy.geofilter.api.exceptions.FilterException;
import io.github.flameyossnowy.geofilter.api.exceptions.UnsupportedPredicateException;
import io.github.flameyossnowy.geofilter.api.expression.AttributeCondition;
import io.github.flameyossnowy.geofilter.api.expression.AttributeFilter;
import io.github.flameyossnowy.geofilter.api.expression.BuildOptions;
import io.github.flameyossnowy.geofilter.api.expression.BuiltExpression;
import io.github.flameyossnowy.geofilter.api.expression.ExpressionBuilder;
import io.github.flameyossnowy.geofilter.api.expression.FilterExpression;
import io.github.flameyossnowy.geofilter.api.layer.Dialect;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.predicate.CombineOperator;
import io.github.flameyossnowy.geofilter.api.predicate.PredicateRegistry;
import io.github.flameyossnowy.geofilter.api.predicate.PredicateSet;
import io.github.flameyossnowy.geofilter.api.source.SourceFeature;
import io.github.flameyossnowy.geofilter.api.source.SourceGeometryRef;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link FilterPlan}s. This builder accepts every request the other dialects reject
 * (per-feature buffers, mixed collections, any end cap), which makes it the fallback.
 */
public final class GenericFormatExpressionBuilder implements ExpressionBuilder {
    static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Override
    public Dialect dialect() {
        return Dialect.GENERIC;
    }

    @NotNull
    @Override
    public BuiltExpression build(
        @Nullable SourceGeometryRef source,
        @NotNull PredicateSet predicates,
        @NotNull CombineOperator operator,
        @NotNull BufferConfig buffer,
        @NotNull LayerInfo target,
        @NotNull BuildOptions options
    ) {
        AttributeFilter attributes = options.attributeFilter();
        List<String> diagnostics = new ArrayList<>();
        List<String> fields = new ArrayList<>();

        if (predicates.isEmpty() && attributes == null) {
            throw new IllegalArgumentException("Nothing to filter on: no predicates and no attribute filter");
        }

        List<FilterPlan.PlanCondition> conditions = new ArrayList<>();
        if (attributes != null) {
            for (AttributeCondition condition : attributes.conditions()) {
                conditions.add(new FilterPlan.PlanCondition(condition.field(), condition.operator(), condition.value()));
            }
            fields.addAll(attributes.fields());
        }

        FilterPlan plan;
        if (predicates.isEmpty()) {
            diagnostics.add("attribute-only filter");
            plan = new FilterPlan(null, target.srid(), null, target.srid(), List.of(), operator, null, 0.0, null, options.metricSrid(), conditions);
        } else {
            plan = spatialPlan(source, predicates, operator, buffer, target, options, conditions, diagnostics);
            fields.add(0, target.geometryColumn());
        }

        return new BuiltExpression(Dialect.GENERIC, new FilterExpression(serialize(plan), plan.spatial(), fields), diagnostics);
    }

    private FilterPlan spatialPlan(
        @Nullable SourceGeometryRef source,
        PredicateSet predicates,
        CombineOperator operator,
        BufferConfig buffer,
        LayerInfo target,
        BuildOptions options,
        List<FilterPlan.PlanCondition> conditions,
        List<String> diagnostics
    ) {
        if (source == null) {
            throw new IllegalArgumentException("Spatial predicates need a source geometry reference");
        }
        if (!(source instanceof SourceGeometryRef.Literal literal)) {
            throw new IllegalStateException("Generic-format filters need an inline source geometry");
        }

        List<String> names = new ArrayList<>(predicates.size());
        for (String predicate : predicates) {
            if (PredicateRegistry.lookup(predicate).isEmpty()) {
                throw new UnsupportedPredicateException(Dialect.GENERIC, predicate);
            }
            names.add(PredicateRegistry.canonicalName(predicate));
        }

        FilterPlan.PlanBuffer planBuffer = null;
        List<FilterPlan.PlanFeature> features = null;
        double tolerance = 0.0;
        if (buffer.effective()) {
            planBuffer = new FilterPlan.PlanBuffer(buffer.distance(), buffer.expression(), buffer.segments(), buffer.endCapStyle(), buffer.joinStyle());
            if (buffer.dynamic()) {
                buffer.parsedExpression();
                features = new ArrayList<>(literal.features().size());
                for (SourceFeature feature : literal.features()) {
                    features.add(new FilterPlan.PlanFeature(feature.wkt(), feature.attributes()));
                }
                diagnostics.add("per-feature buffer " + buffer.expression() + " over " + features.size() + " source features");
            } else if (options.simplifyWktThreshold() > 0 && literal.wkt().length() > options.simplifyWktThreshold()) {
                tolerance = buffer.simplifyTolerance();
                diagnostics.add("source simplified with tolerance " + tolerance);
            }
        }

        if (options.useCentroids()) {
            diagnostics.add("target geometry replaced by " + options.centroidMode());
        }

        return new FilterPlan(
            literal.wkt(),
            literal.srid(),
            features,
            target.srid(),
            names,
            operator,
            planBuffer,
            tolerance,
            options.useCentroids() ? options.centroidMode() : null,
            options.metricSrid(),
            conditions
        );
    }

    private static String serialize(FilterPlan plan) {
        try {
            return MAPPER.writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new FilterException("Failed to serialize filter plan: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads back a plan produced by {@link #build}.
     */
    public static FilterPlan parse(@NotNull String raw) {
        try {
            return MAPPER.readValue(raw, FilterPlan.class);
        } catch (JsonProcessingException e) {
            throw new FilterException("Malformed filter plan: " + e.getOriginalMessage(), e);
        }
    }
}
