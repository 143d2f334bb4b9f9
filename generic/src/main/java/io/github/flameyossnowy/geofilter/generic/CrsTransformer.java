package io.github.flameyossnowy.geofilter.generic;

import io.github.flameyossnowy.geofilter.api.exceptions.FilterException;
import io.github.flameyossnowy.geofilter.api.layer.CrsSupport;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.Proj4jException;
import org.locationtech.proj4j.ProjCoordinate;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reprojects geometries between EPSG codes for the in-process evaluator.
 * <p>
 * 4326 and 3857 go through {@link WebMercator}; every other pair is resolved from the
 * EPSG registry bundled with proj4j. CRS definitions are parsed once and shared; a
 * {@link CoordinateTransform} keeps per-call state and is built for each geometry.
 */
public final class CrsTransformer {
    private static final CRSFactory CRS_FACTORY = new CRSFactory();
    private static final CoordinateTransformFactory TRANSFORM_FACTORY = new CoordinateTransformFactory();
    private static final Map<Integer, CoordinateReferenceSystem> SYSTEMS = new ConcurrentHashMap<>();

    private CrsTransformer() {}

    /**
     * Returns a copy of {@code geometry} in {@code toSrid}, or the geometry itself when both
     * codes are equal.
     *
     * @throws FilterException when either code is unknown to the EPSG registry
     */
    public static Geometry transform(Geometry geometry, int fromSrid, int toSrid) {
        if (fromSrid == toSrid) {
            return geometry;
        }
        if (isWebMercatorPair(fromSrid, toSrid)) {
            return WebMercator.transform(geometry, fromSrid, toSrid);
        }

        CoordinateReferenceSystem source = crs(fromSrid);
        CoordinateReferenceSystem target = crs(toSrid);
        Geometry copy = geometry.copy();
        try {
            copy.apply(new Projection(TRANSFORM_FACTORY.createTransform(source, target)));
        } catch (Proj4jException e) {
            throw new FilterException("Cannot reproject from EPSG:" + fromSrid + " to EPSG:" + toSrid + ": " + e.getMessage(), e);
        }
        copy.setSRID(toSrid);
        return copy;
    }

    private static boolean isWebMercatorPair(int fromSrid, int toSrid) {
        return (fromSrid == CrsSupport.WGS84 && toSrid == CrsSupport.WEB_MERCATOR)
            || (fromSrid == CrsSupport.WEB_MERCATOR && toSrid == CrsSupport.WGS84);
    }

    private static CoordinateReferenceSystem crs(int srid) {
        CoordinateReferenceSystem cached = SYSTEMS.get(srid);
        if (cached != null) {
            return cached;
        }

        try {
            CoordinateReferenceSystem created = CRS_FACTORY.createFromName("EPSG:" + srid);
            CoordinateReferenceSystem previous = SYSTEMS.putIfAbsent(srid, created);
            return previous == null ? created : previous;
        } catch (Proj4jException e) {
            throw new FilterException("Unknown CRS EPSG:" + srid + ": " + e.getMessage(), e);
        }
    }

    private static final class Projection implements CoordinateSequenceFilter {
        private final CoordinateTransform transform;
        private final ProjCoordinate in = new ProjCoordinate();
        private final ProjCoordinate out = new ProjCoordinate();

        Projection(CoordinateTransform transform) {
            this.transform = transform;
        }

        @Override
        public void filter(CoordinateSequence sequence, int i) {
            in.x = sequence.getX(i);
            in.y = sequence.getY(i);
            transform.transform(in, out);
            sequence.setOrdinate(i, CoordinateSequence.X, out.x);
            sequence.setOrdinate(i, CoordinateSequence.Y, out.y);
        }

        @Override
        public boolean isDone() {
            return false;
        }

        @Override
        public boolean isGeometryChanged() {
            return true;
        }
    }
}
