package io.github.flameyossnowy.geofilter.sql.query;

import io.github.flameyossnowy.geofilter.api.buffer.BufferConfig;
import io.github.flameyossnowy.geofilter.api.exceptions.UnsupportedFeatureException;
import io.github.flameyossnowy.geofilter.api.exceptions.UnsupportedPredicateException;
import io.github.flameyossnowy.geofilter.api.expression.AttributeFilter;
import io.github.flameyossnowy.geofilter.api.expression.BuildOptions;
import io.github.flameyossnowy.geofilter.api.expression.BuiltExpression;
import io.github.flameyossnowy.geofilter.api.expression.CentroidMode;
import io.github.flameyossnowy.geofilter.api.expression.ExpressionBuilder;
import io.github.flameyossnowy.geofilter.api.expression.FilterExpression;
import io.github.flameyossnowy.geofilter.api.layer.CrsSupport;
import io.github.flameyossnowy.geofilter.api.layer.Dialect;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.predicate.CombineOperator;
import io.github.flameyossnowy.geofilter.api.predicate.PredicateRegistry;
import io.github.flameyossnowy.geofilter.api.predicate.PredicateSet;
import io.github.flameyossnowy.geofilter.api.source.SourceGeometryRef;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Filter construction shared by the SQL dialects. Subclasses supply the function names and
 * the few places where the dialects disagree; the order of operations lives here:
 * <ol>
 *     <li>source reference: inline literal or correlated table column</li>
 *     <li>reproject geographic sources to the metric CRS, then simplify and buffer, then
 *     reproject to the target CRS</li>
 *     <li>one test per predicate, in selectivity order, joined by the caller's operator</li>
 *     <li>correlated sources wrapped in {@code EXISTS}, attribute conditions ANDed last</li>
 * </ol>
 */
public abstract class AbstractSqlExpressionBuilder implements ExpressionBuilder {
    public static final String SOURCE_ALIAS = "__source";

    private final Dialect dialect;

    protected AbstractSqlExpressionBuilder(Dialect dialect) {
        this.dialect = dialect;
    }

    @Override
    public Dialect dialect() {
        return dialect;
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

        if (predicates.isEmpty()) {
            if (attributes == null) {
                throw new IllegalArgumentException("Nothing to filter on: no predicates and no attribute filter");
            }
            diagnostics.add("attribute-only filter");
            return new BuiltExpression(dialect, new FilterExpression(SqlAttributeRenderer.render(attributes), false, attributes.fields()), diagnostics);
        }

        if (source == null) {
            throw new IllegalArgumentException("Spatial predicates need a source geometry reference");
        }

        List<String> symbols = new ArrayList<>(predicates.size());
        for (String predicate : predicates) {
            String symbol = PredicateRegistry.dialectSymbol(predicate, dialect)
                .orElseThrow(() -> new UnsupportedPredicateException(dialect, predicate));
            symbols.add(symbol);
        }

        checkSupported(source, buffer, target);

        String targetGeometry = targetGeometry(target);
        fields.add(target.geometryColumn());
        if (options.useCentroids()) {
            targetGeometry = centroid(targetGeometry, options.centroidMode());
            diagnostics.add("target geometry replaced by " + options.centroidMode());
        }

        String sourceGeometry = sourceGeometry(source, buffer, target.srid(), options, diagnostics, fields);

        StringJoiner tests = new StringJoiner(operator.sql());
        for (String symbol : symbols) {
            tests.add(predicateTest(symbol, targetGeometry, sourceGeometry));
        }
        String combined = symbols.size() == 1 ? tests.toString() : "(" + tests + ")";

        String spatial = combined;
        if (source instanceof SourceGeometryRef.TableReference reference) {
            spatial = correlate(reference, combined);
            diagnostics.add("correlated with " + SqlIdentifiers.qualified(reference.schema(), reference.table()));
        } else {
            diagnostics.add("literal source geometry");
        }

        if (attributes != null) {
            spatial = spatial + " AND " + wrap(attributes);
            fields.addAll(attributes.fields());
        }

        return new BuiltExpression(dialect, new FilterExpression(spatial, true, fields), diagnostics);
    }

    private String sourceGeometry(
        SourceGeometryRef source,
        BufferConfig buffer,
        int targetSrid,
        BuildOptions options,
        List<String> diagnostics,
        List<String> fields
    ) {
        int sourceSrid = source.srid();
        String geometry;
        int literalLength = 0;

        if (source instanceof SourceGeometryRef.Literal literal) {
            geometry = literalGeometry(literal.wkt(), sourceSrid);
            literalLength = literal.wkt().length();
        } else {
            SourceGeometryRef.TableReference reference = (SourceGeometryRef.TableReference) source;
            geometry = sourceColumn(reference);
            fields.add(reference.geometryColumn());
        }

        if (!buffer.effective()) {
            if (sourceSrid != targetSrid) {
                diagnostics.add("source reprojected from EPSG:" + sourceSrid + " to EPSG:" + targetSrid);
                return transform(geometry, targetSrid);
            }
            return geometry;
        }

        int bufferSrid = sourceSrid;
        if (CrsSupport.isGeographic(sourceSrid)) {
            geometry = transform(geometry, options.metricSrid());
            bufferSrid = options.metricSrid();
            diagnostics.add("geographic source reprojected to EPSG:" + bufferSrid + " before buffering");
        }

        if (literalLength > 0 && options.simplifyWktThreshold() > 0 && literalLength > options.simplifyWktThreshold()) {
            geometry = simplify(geometry, buffer.simplifyTolerance());
            diagnostics.add("source simplified with tolerance " + SqlLiterals.number(buffer.simplifyTolerance()));
        }

        String distance;
        if (buffer.dynamic()) {
            distance = buffer.parsedExpression().render(field -> numericField(SqlIdentifiers.column(SOURCE_ALIAS, field)));
            fields.addAll(buffer.parsedExpression().referencedFields());
            diagnostics.add("per-feature buffer " + buffer.expression());
        } else {
            distance = SqlLiterals.number(buffer.distance());
        }

        geometry = bufferCall(geometry, distance, buffer);
        if (buffer.erodes()) {
            geometry = erosionGuard(geometry);
            diagnostics.add("negative buffer guarded against empty results");
        }

        if (bufferSrid != targetSrid) {
            geometry = transform(geometry, targetSrid);
        }
        return geometry;
    }

    private String correlate(SourceGeometryRef.TableReference reference, String tests) {
        StringBuilder builder = new StringBuilder("EXISTS (SELECT 1 FROM ")
            .append(SqlIdentifiers.qualified(reference.schema(), reference.table()))
            .append(" AS ")
            .append(SOURCE_ALIAS)
            .append(" WHERE ")
            .append(tests);

        String sourceFilter = reference.sourceFilter();
        if (sourceFilter != null && !sourceFilter.isBlank()) {
            builder.append(" AND (").append(sourceFilter.trim()).append(')');
        }

        return builder.append(')').toString();
    }

    private static String wrap(AttributeFilter attributes) {
        String rendered = SqlAttributeRenderer.render(attributes);
        return attributes.conditions().size() == 1 ? rendered : "(" + rendered + ")";
    }

    /**
     * Rejects what this dialect cannot express, so the engine can fall back.
     *
     * @throws UnsupportedFeatureException if the request needs the generic builder
     */
    protected void checkSupported(SourceGeometryRef source, BufferConfig buffer, LayerInfo target) {
        if (buffer.dynamic() && source instanceof SourceGeometryRef.Literal) {
            throw new UnsupportedFeatureException(dialect, "a per-feature buffer needs a correlated source table");
        }
    }

    protected String targetGeometry(LayerInfo target) {
        return SqlIdentifiers.column(target.table(), target.geometryColumn());
    }

    protected String sourceColumn(SourceGeometryRef.TableReference reference) {
        return SqlIdentifiers.column(SOURCE_ALIAS, reference.geometryColumn());
    }

    protected abstract String literalGeometry(String wkt, int srid);

    protected abstract String transform(String geometry, int srid);

    protected abstract String simplify(String geometry, double tolerance);

    protected abstract String bufferCall(String geometry, String distance, BufferConfig buffer);

    /**
     * Casts a source column used in a buffer expression to the dialect's double type.
     */
    protected abstract String numericField(String column);

    protected abstract String erosionGuard(String geometry);

    protected abstract String centroid(String geometry, CentroidMode mode);

    protected abstract String predicateTest(String symbol, String targetGeometry, String sourceGeometry);
}
