package io.github.flameyossnowy.geofilter.postgresql;

import io.github.flameyossnowy.geofilter.api.backend.BackendCapability;
import io.github.flameyossnowy.geofilter.api.backend.BackendMetrics;
import io.github.flameyossnowy.geofilter.api.backend.FilterBackend;
import io.github.flameyossnowy.geofilter.api.backend.FilterExecutor;
import io.github.flameyossnowy.geofilter.api.expression.ExpressionBuilder;
import io.github.flameyossnowy.geofilter.api.layer.StorageKind;
import io.github.flameyossnowy.geofilter.postgresql.query.PostGisExpressionBuilder;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public final class PostgreSQLBackend implements FilterBackend {
    public static final String NAME = "postgresql";

    private static final Set<BackendCapability> CAPABILITIES = Collections.unmodifiableSet(EnumSet.allOf(BackendCapability.class));

    private final ExpressionBuilder builder = new PostGisExpressionBuilder();
    private final BackendMetrics metrics;
    private final PostgreSQLFilterExecutor executor;

    PostgreSQLBackend(BackendMetrics metrics, PostgreSQLFilterExecutor executor) {
        this.metrics = metrics;
        this.executor = executor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StorageKind storageKind() {
        return StorageKind.RELATIONAL_STORE;
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
