package io.github.flameyossnowy.geofilter.api.backend;

/**
 * Optional speed-ups a backend may apply. None of them changes which features match.
 */
public enum Optimizations {
    /**
     * Materialize large relational filters into an indexed, session-scoped result set.
     */
    MATERIALIZED_RESULT_SETS,

    /**
     * Create a spatial index on the target geometry column when none exists.
     */
    SPATIAL_INDEXES
}
