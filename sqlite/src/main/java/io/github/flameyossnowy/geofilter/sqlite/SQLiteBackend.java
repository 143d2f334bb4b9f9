package io.github.flameyossnowy.geofilter.sqlite;

import io.github.flameyossnowy.geofilter.api.backend.BackendCapability;
import io.github.flameyossnowy.geofilter.api.backend.BackendMetrics;
import io.github.flameyossnowy.geofilter.api.backend.FilterBackend;
import io.github.flameyossnowy.geofilter.api.backend.FilterExecutor;
import io.github.flameyossnowy.geofilter.api.expression.ExpressionBuilder;
import io.github.flameyossnowy.geofilter.api.layer.StorageKind;
import io.github.flameyossnowy.geofilter.sqlite.query.SpatiaLiteExpressionBuilder;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public final class SQLiteBackend implements FilterBackend {
    public static final String NAME = "spatialite";

    private static final Set<BackendCapability> CAPABILITIES = Collections.unmodifiableSet(EnumSet.of(
        BackendCapability.SPATIAL_FILTER,
        BackendCapability.PREPARED_STATEMENTS,
        BackendCapability.CONNECTION_POOLING,
        BackendCapability.SPATIAL_INDEX
    ));

    private final ExpressionBuilder builder = new SpatiaLiteExpressionBuilder();
    private final BackendMetrics metrics;
    private final SpatiaLiteFilterExecutor executor;

    SQLiteBackend(BackendMetrics metrics, SpatiaLiteFilterExecutor executor) {
        this.metrics = metrics;
        this.executor = executor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StorageKind storageKind() {
        return StorageKind.EMBEDDED_STORE;
    }

    @Override
    public Set<BackendCapability> capabilities() {
        return CAPABILITIES;
    }

    @Override
    public ExpressionBuilder builder() {
        return builder;
    }

    @Override
    public FilterExecutor executor() {
        return executor;
    }

    @Override
    public BackendMetrics metrics() {
        return metrics;
    }
}
