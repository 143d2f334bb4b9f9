package io.github.flameyossnowy.geofilter.api.backend;

public enum BackendCapability {
    SPATIAL_FILTER,
    MATERIALIZED_RESULT_SET,
    PREPARED_STATEMENTS,
    CONNECTION_POOLING,
    SPATIAL_INDEX
}
