package io.github.flameyossnowy.geofilter.sqlite.query;

import io.github.flameyossnowy.geofilter.api.buffer.BufferConfig;
import io.github.flameyossnowy.geofilter.api.buffer.EndCapStyle;
import io.github.flameyossnowy.geofilter.api.buffer.JoinStyle;
import io.github.flameyossnowy.geofilter.api.exceptions.UnsupportedFeatureException;
import io.github.flameyossnowy.geofilter.api.expression.CentroidMode;
import io.github.flameyossnowy.geofilter.api.layer.Dialect;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.source.SourceGeometryRef;
import io.github.flameyossnowy.geofilter.sql.query.AbstractSqlExpressionBuilder;
import io.github.flameyossnowy.geofilter.sql.query.SqlIdentifiers;
import io.github.flameyossnowy.geofilter.sql.query.SqlLiterals;

/**
 * SpatiaLite rendering, for SpatiaLite databases and GeoPackage files.
 * <p>
 * Predicates return integers, so each test reads {@code Intersects(target, source) = 1}.
 * GeoPackage geometry blobs are decoded with {@code GeomFromGPB} first.
 */
public final class SpatiaLiteExpressionBuilder extends AbstractSqlExpressionBuilder {
    public SpatiaLiteExpressionBuilder() {
        super(Dialect.SPATIALITE);
    }

    @Override
    protected void checkSupported(SourceGeometryRef source, BufferConfig buffer, LayerInfo target) {
        if (buffer.dynamic()) {
            throw new UnsupportedFeatureException(dialect(), "per-feature buffer expressions");
        }
        if (source instanceof SourceGeometryRef.Literal literal && literal.mixedCollection()) {
            throw new UnsupportedFeatureException(dialect(), "mixed geometry collections");
        }
        if (buffer.effective() && (buffer.endCapStyle() != EndCapStyle.ROUND || buffer.joinStyle() != JoinStyle.ROUND)) {
            throw new UnsupportedFeatureException(dialect(), "buffer end cap " + buffer.endCapStyle() + " / join " + buffer.joinStyle());
        }
    }

    @Override
    protected String targetGeometry(LayerInfo target) {
        String column = super.targetGeometry(target);
        return target.isGeoPackage() ? "GeomFromGPB(" + column + ")" : column;
    }

    @Override
    protected String sourceColumn(SourceGeometryRef.TableReference reference) {
        String column = SqlIdentifiers.column(SOURCE_ALIAS, reference.geometryColumn());
        return reference.geoPackage() ? "GeomFromGPB(" + column + ")" : column;
    }

    @Override
    protected String literalGeometry(String wkt, int srid) {
        return "MakeValid(GeomFromText(" + SqlLiterals.string(wkt) + ", " + srid + "))";
    }

    @Override
    protected String transform(String geometry, int srid) {
        return "Transform(" + geometry + ", " + srid + ")";
    }

    @Override
    protected String simplify(String geometry, double tolerance) {
        return "SimplifyPreserveTopology(" + geometry + ", " + SqlLiterals.number(tolerance) + ")";
    }

    @Override
    protected String bufferCall(String geometry, String distance, BufferConfig buffer) {
        return "Buffer(" + geometry + ", " + distance + ", " + buffer.segments() + ")";
    }

    @Override
    protected String numericField(String column) {
        return "CAST(" + column + " AS REAL)";
    }

    @Override
    protected String erosionGuard(String geometry) {
        return "MakeValid(" + geometry + ")";
    }

    @Override
    protected String centroid(String geometry, CentroidMode mode) {
        return switch (mode) {
            case POINT_ON_SURFACE -> "PointOnSurface(" + geometry + ")";
            case CENTROID -> "Centroid(" + geometry + ")";
        };
    }

    @Override
    protected String predicateTest(String symbol, String targetGeometry, String sourceGeometry) {
        return symbol + "(" + targetGeometry + ", " + sourceGeometry + ") = 1";
    }
}
