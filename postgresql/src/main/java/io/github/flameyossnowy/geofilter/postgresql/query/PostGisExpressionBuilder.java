package io.github.flameyossnowy.geofilter.postgresql.query;

import io.github.flameyossnowy.geofilter.api.buffer.BufferConfig;
import io.github.flameyossnowy.geofilter.api.buffer.EndCapStyle;
import io.github.flameyossnowy.geofilter.api.buffer.JoinStyle;
import io.github.flameyossnowy.geofilter.api.exceptions.UnsupportedFeatureException;
import io.github.flameyossnowy.geofilter.api.expression.CentroidMode;
import io.github.flameyossnowy.geofilter.api.layer.Dialect;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.source.SourceGeometryRef;
import io.github.flameyossnowy.geofilter.sql.query.AbstractSqlExpressionBuilder;
import io.github.flameyossnowy.geofilter.sql.query.SqlLiterals;

/**
 * PostGIS rendering. Predicates are boolean functions, {@code ST_Intersects(target, source)}.
 */
public final class PostGisExpressionBuilder extends AbstractSqlExpressionBuilder {
    public PostGisExpressionBuilder() {
        super(Dialect.POSTGIS);
    }

    @Override
    protected void checkSupported(SourceGeometryRef source, BufferConfig buffer, LayerInfo target) {
        super.checkSupported(source, buffer, target);
        if (buffer.effective() && source instanceof SourceGeometryRef.Literal literal && literal.mixedCollection()) {
            throw new UnsupportedFeatureException(dialect(), "ST_Buffer does not accept a mixed geometry collection");
        }
    }

    @Override
    protected String literalGeometry(String wkt, int srid) {
        return "ST_MakeValid(ST_GeomFromText(" + SqlLiterals.string(wkt) + ", " + srid + "))";
    }

    @Override
    protected String transform(String geometry, int srid) {
        return "ST_Transform(" + geometry + ", " + srid + ")";
    }

    @Override
    protected String simplify(String geometry, double tolerance) {
        return "ST_SimplifyPreserveTopology(" + geometry + ", " + SqlLiterals.number(tolerance) + ")";
    }

    @Override
    protected String bufferCall(String geometry, String distance, BufferConfig buffer) {
        return "ST_Buffer(" + geometry + ", " + distance + ", " + SqlLiterals.string(style(buffer)) + ")";
    }

    @Override
    protected String numericField(String column) {
        return "CAST(" + column + " AS double precision)";
    }

    @Override
    protected String erosionGuard(String geometry) {
        String valid = "ST_MakeValid(" + geometry + ")";
        return "CASE WHEN ST_IsEmpty(" + valid + ") THEN NULL ELSE " + valid + " END";
    }

    @Override
    protected String centroid(String geometry, CentroidMode mode) {
        return switch (mode) {
            case POINT_ON_SURFACE -> "ST_PointOnSurface(" + geometry + ")";
            case CENTROID -> "ST_Centroid(" + geometry + ")";
        };
    }

    @Override
    protected String predicateTest(String symbol, String targetGeometry, String sourceGeometry) {
        return symbol + "(" + targetGeometry + ", " + sourceGeometry + ")";
    }

    /**
     * {@code quad_segs=5}, plus {@code endcap=} and {@code join=} when not round.
     */
    static String style(BufferConfig buffer) {
        StringBuilder style = new StringBuilder("quad_segs=").append(buffer.segments());
        if (buffer.endCapStyle() != EndCapStyle.ROUND) {
            style.append(" endcap=").append(buffer.endCapStyle().keyword());
        }
        if (buffer.joinStyle() != JoinStyle.ROUND) {
            style.append(" join=").append(buffer.joinStyle().keyword());
        }
        return style.toString();
    }
}
