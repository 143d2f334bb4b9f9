package io.github.flameyossnowy.geofilter.generic;

import io.github.flameyossnowy.geofilter.api.backend.BackendCapability;
import io.github.flameyossnowy.geofilter.api.backend.BackendMetrics;
import io.github.flameyossnowy.geofilter.api.backend.FilterBackend;
import io.github.flameyossnowy.geofilter.api.backend.FilterExecutor;
import io.github.flameyossnowy.geofilter.api.expression.ExpressionBuilder;
import io.github.flameyossnowy.geofilter.api.layer.StorageKind;
import io.github.flameyossnowy.geofilter.generic.query.GenericFormatExpressionBuilder;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * In-process backend for file formats without a spatial SQL engine. Also the selector's
 * fallback for requests the SQL dialects reject.
 */
public final class GenericBackend implements FilterBackend {
    public static final String NAME = "ogr";

    private static final Set<BackendCapability> CAPABILITIES = Collections.unmodifiableSet(EnumSet.of(BackendCapability.SPATIAL_FILTER));

    private final ExpressionBuilder builder = new GenericFormatExpressionBuilder();
    private final BackendMetrics metrics;
    private final GenericFormatFilterExecutor executor;

    GenericBackend(BackendMetrics metrics, GenericFormatFilterExecutor executor) {
        this.metrics = metrics;
        this.executor = executor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StorageKind storageKind() {
        return StorageKind.GENERIC_FORMAT;
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
