package io.github.flameyossnowy.geofilter.generic;

import io.github.flameyossnowy.geofilter.api.backend.BackendMetrics;
import io.github.flameyossnowy.geofilter.api.backend.ExecutionRequest;
import io.github.flameyossnowy.geofilter.api.backend.FilterExecutor;
import io.github.flameyossnowy.geofilter.api.buffer.BufferExpression;
import io.github.flameyossnowy.geofilter.api.buffer.EndCapStyle;
import io.github.flameyossnowy.geofilter.api.buffer.JoinStyle;
import io.github.flameyossnowy.geofilter.api.engine.FilterEngineConfig;
import io.github.flameyossnowy.geofilter.api.exceptions.FilterException;
import io.github.flameyossnowy.geofilter.api.expression.AttributeCondition;
import io.github.flameyossnowy.geofilter.api.expression.AttributeFilter;
import io.github.flameyossnowy.geofilter.api.expression.CentroidMode;
import io.github.flameyossnowy.geofilter.api.layer.CrsSupport;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.layer.PrimaryKeyDescriptor;
import io.github.flameyossnowy.geofilter.api.result.FilterResult;
import io.github.flameyossnowy.geofilter.api.session.CancellationToken;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import io.github.flameyossnowy.geofilter.generic.features.Feature;
import io.github.flameyossnowy.geofilter.generic.features.FeatureSource;
import io.github.flameyossnowy.geofilter.generic.query.FilterPlan;
import io.github.flameyossnowy.geofilter.generic.query.GenericFormatExpressionBuilder;
import org.jetbrains.annotations.NotNull;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.operation.buffer.BufferOp;
import org.locationtech.jts.operation.buffer.BufferParameters;
import org.locationtech.jts.simplify.TopologyPreservingSimplifier;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * Evaluates a {@link FilterPlan} against the target's features with JTS.
 * <p>
 * The source is prepared once per execution: reprojected to the metric CRS when it is
 * geographic and buffered, simplified first when the plan asks for it, then brought to the
 * target CRS. Each target feature then goes through the attribute conditions and the
 * predicate tests.
 */
public final class GenericFormatFilterExecutor implements FilterExecutor {
    private final FeatureSource featureSource;
    private final BackendMetrics metrics;
    private final FilterEngineConfig config;

    public GenericFormatFilterExecutor(FeatureSource featureSource, BackendMetrics metrics, FilterEngineConfig config) {
        this.featureSource = featureSource;
        this.metrics = metrics;
        this.config = config;
    }

    @NotNull
    @Override
    public FilterResult execute(@NotNull ExecutionRequest request) {
        long start = System.nanoTime();
        LayerInfo target = request.target();
        CancellationToken cancellation = request.cancellation();
        FilterPlan plan = GenericFormatExpressionBuilder.parse(request.built().raw());

        AttributeFilter attributes = attributeFilter(plan);
        JtsPredicateEvaluator evaluator = plan.spatial()
            ? new JtsPredicateEvaluator(plan.predicates(), plan.operator(), sourceParts(plan))
            : null;

        List<Object> ids = new ArrayList<>();
        if (evaluator == null || evaluator.hasSource()) {
            int interval = config.cancellationCheckInterval();
            int seen = 0;
            for (Feature feature : featureSource.features(target)) {
                if (++seen % interval == 0) {
                    cancellation.throwIfCancelled("evaluation of " + target.name());
                }
                if (attributes != null && !attributes.matches(feature.attributes())) {
                    continue;
                }
                if (evaluator != null && !evaluator.matches(targetGeometry(feature.geometry(), plan.centroidMode()))) {
                    continue;
                }
                ids.add(target.primaryKey().normalize(feature.id()));
            }
        } else {
            Logging.info(() -> "[" + GenericBackend.NAME + "] buffered source of " + target.id() + " is empty, nothing matches");
        }

        long elapsed = System.nanoTime() - start;
        metrics.recordExecution(elapsed, false);
        Logging.info(() -> "[" + GenericBackend.NAME + "] " + target.id() + " matched " + ids.size() + " features in "
            + TimeUnit.NANOSECONDS.toMillis(elapsed) + " ms");

        return FilterResult.success(target.id(), GenericBackend.NAME, ids, filterText(target.primaryKey(), ids),
            TimeUnit.NANOSECONDS.toMillis(elapsed), false);
    }

    private static AttributeFilter attributeFilter(FilterPlan plan) {
        if (plan.conditions().isEmpty()) {
            return null;
        }
        List<AttributeCondition> conditions = new ArrayList<>(plan.conditions().size());
        for (FilterPlan.PlanCondition condition : plan.conditions()) {
            conditions.add(new AttributeCondition(condition.field(), condition.operator(), condition.value()));
        }
        return new AttributeFilter(conditions);
    }

    private static Geometry targetGeometry(Geometry geometry, CentroidMode mode) {
        if (geometry == null || mode == null || geometry.isEmpty()) {
            return geometry;
        }
        return mode == CentroidMode.CENTROID ? geometry.getCentroid() : geometry.getInteriorPoint();
    }

    private List<Geometry> sourceParts(FilterPlan plan) {
        GeometryFactory factory = new GeometryFactory(new PrecisionModel(), plan.sourceSrid());
        WKTReader reader = new WKTReader(factory);
        FilterPlan.PlanBuffer buffer = plan.buffer();

        if (buffer == null) {
            return List.of(toTarget(read(reader, plan.sourceWkt()), plan.sourceSrid(), plan));
        }

        if (buffer.expression() == null) {
            Geometry source = read(reader, plan.sourceWkt());
            return List.of(bufferPart(source, buffer.distance(), buffer, plan));
        }

        BufferExpression expression = BufferExpression.parse(buffer.expression());
        List<FilterPlan.PlanFeature> features = plan.sourceFeatures() == null ? List.of() : plan.sourceFeatures();
        List<Geometry> parts = new ArrayList<>(features.size());
        for (FilterPlan.PlanFeature feature : features) {
            OptionalDouble distance = expression.evaluate(feature.attributes());
            if (distance.isEmpty()) {
                continue;
            }
            parts.add(bufferPart(read(reader, feature.wkt()), distance.getAsDouble(), buffer, plan));
        }
        return parts;
    }

    private Geometry bufferPart(Geometry source, double distance, FilterPlan.PlanBuffer buffer, FilterPlan plan) {
        int srid = plan.sourceSrid();
        Geometry geometry = source;
        if (CrsSupport.isGeographic(srid)) {
            geometry = CrsTransformer.transform(geometry, srid, plan.metricSrid());
            srid = plan.metricSrid();
        }
        if (plan.simplifyTolerance() > 0) {
            geometry = TopologyPreservingSimplifier.simplify(geometry, plan.simplifyTolerance());
        }

        Geometry buffered = BufferOp.bufferOp(geometry, distance, parameters(buffer));
        buffered.setSRID(srid);
        if (buffered.isEmpty()) {
            return buffered;
        }
        return toTarget(buffered, srid, plan);
    }

    private static Geometry toTarget(Geometry geometry, int srid, FilterPlan plan) {
        return CrsTransformer.transform(geometry, srid, plan.targetSrid());
    }

    static BufferParameters parameters(FilterPlan.PlanBuffer buffer) {
        BufferParameters parameters = new BufferParameters();
        parameters.setQuadrantSegments(buffer.segments());
        parameters.setEndCapStyle(endCap(buffer.endCapStyle()));
        parameters.setJoinStyle(join(buffer.joinStyle()));
        return parameters;
    }

    private static int endCap(EndCapStyle style) {
        return switch (style) {
            case ROUND -> BufferParameters.CAP_ROUND;
            case FLAT -> BufferParameters.CAP_FLAT;
            case SQUARE -> BufferParameters.CAP_SQUARE;
        };
    }

    private static int join(JoinStyle style) {
        return switch (style) {
            case ROUND -> BufferParameters.JOIN_ROUND;
            case MITRE -> BufferParameters.JOIN_MITRE;
            case BEVEL -> BufferParameters.JOIN_BEVEL;
        };
    }

    private static Geometry read(WKTReader reader, String wkt) {
        try {
            return reader.read(wkt);
        } catch (ParseException e) {
            throw new FilterException("Invalid source WKT: " + e.getMessage(), e);
        }
    }

    /**
     * Subset text for the host: the matched keys as an {@code IN} list.
     */
    static String filterText(PrimaryKeyDescriptor primaryKey, List<Object> ids) {
        if (ids.isEmpty()) {
            return "1 = 0";
        }

        StringJoiner joiner = new StringJoiner(", ", "\"" + primaryKey.name().replace("\"", "\"\"") + "\" IN (", ")");
        for (Object id : ids) {
            if (id instanceof Number) {
                joiner.add(id.toString());
            } else {
                joiner.add("'" + id.toString().replace("'", "''") + "'");
            }
        }
        return joiner.toString();
    }
}
