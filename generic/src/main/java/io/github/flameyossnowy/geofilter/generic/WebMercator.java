package io.github.flameyossnowy.geofilter.generic;

import io.github.flameyossnowy.geofilter.api.exceptions.FilterException;
import io.github.flameyossnowy.geofilter.api.layer.CrsSupport;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;

/**
 * Spherical mercator between EPSG:4326 and EPSG:3857, the only reprojection the in-process
 * evaluator performs.
 */
public final class WebMercator {
    private static final double RADIUS = 6378137.0;
    private static final double MAX_LATITUDE = 85.0511287798;

    private WebMercator() {}

    /**
     * Returns a copy of {@code geometry} in {@code toSrid}.
     *
     * @throws FilterException for any pair other than 4326 and 3857
     */
    public static Geometry transform(Geometry geometry, int fromSrid, int toSrid) {
        if (fromSrid == toSrid) {
            return geometry;
        }

        boolean forward;
        if (fromSrid == CrsSupport.WGS84 && toSrid == CrsSupport.WEB_MERCATOR) {
            forward = true;
        } else if (fromSrid == CrsSupport.WEB_MERCATOR && toSrid == CrsSupport.WGS84) {
            forward = false;
        } else {
            throw new FilterException("Cannot reproject in-process from EPSG:" + fromSrid + " to EPSG:" + toSrid);
        }

        Geometry copy = geometry.copy();
        copy.apply(new Projection(forward));
        copy.setSRID(toSrid);
        return copy;
    }

    static double[] forward(double longitude, double latitude) {
        double clamped = Math.max(-MAX_LATITUDE, Math.min(MAX_LATITUDE, latitude));
        double x = RADIUS * Math.toRadians(longitude);
        double y = RADIUS * Math.log(Math.tan(Math.PI / 4 + Math.toRadians(clamped) / 2));
        return new double[] {x, y};
    }

    static double[] inverse(double x, double y) {
        double longitude = Math.toDegrees(x / RADIUS);
        double latitude = Math.toDegrees(2 * Math.atan(Math.exp(y / RADIUS)) - Math.PI / 2);
        return new double[] {longitude, latitude};
    }

    private static final class Projection implements CoordinateSequenceFilter {
        private final boolean forward;

        Projection(boolean forward) {
            this.forward = forward;
        }

        @Override
        public void filter(CoordinateSequence sequence, int i) {
            double[] projected = forward
                ? forward(sequence.getX(i), sequence.getY(i))
                : inverse(sequence.getX(i), sequence.getY(i));
            sequence.setOrdinate(i, CoordinateSequence.X, projected[0]);
            sequence.setOrdinate(i, CoordinateSequence.Y, projected[1]);
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
