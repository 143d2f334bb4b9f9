package io.github.flameyossnowy.geofilter.api.layer;

public enum Dialect {
    POSTGIS,
    SPATIALITE,
    GENERIC
}
