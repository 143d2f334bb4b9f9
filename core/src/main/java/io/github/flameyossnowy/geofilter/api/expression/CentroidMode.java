package io.github.flameyossnowy.geofilter.api.expression;

public enum CentroidMode {
    /**
     * A point guaranteed to lie on the geometry. Safe for concave polygons.
     */
    POINT_ON_SURFACE,
    CENTROID
}
