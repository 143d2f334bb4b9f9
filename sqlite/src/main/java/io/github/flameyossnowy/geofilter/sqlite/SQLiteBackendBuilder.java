package io.github.flameyossnowy.geofilter.sqlite;

import io.github.flameyossnowy.geofilter.api.backend.BackendMetrics;
import io.github.flameyossnowy.geofilter.api.backend.Optimizations;
import io.github.flameyossnowy.geofilter.api.engine.FilterEngineConfig;
import io.github.flameyossnowy.geofilter.sql.SQLConnectionProvider;
import io.github.flameyossnowy.geofilter.sqlite.connections.SQLiteConnectionProvider;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.function.Function;

@SuppressWarnings("unused")
public class SQLiteBackendBuilder {
    private Function<String, SQLConnectionProvider> connectionProvider;
    private final EnumSet<Optimizations> optimizations = EnumSet.noneOf(Optimizations.class);
    private FilterEngineConfig config;
    private boolean loadSpatialite = true;

    /**
     * Overrides how a database file is opened. The function receives the layer's file path.
     */
    public SQLiteBackendBuilder withConnectionProvider(Function<String, SQLConnectionProvider> connectionProvider) {
        this.connectionProvider = connectionProvider;
        return this;
    }

    public SQLiteBackendBuilder withOptimizations(Optimizations... optimizations) {
        Collections.addAll(this.optimizations, optimizations);
        return this;
    }

    public SQLiteBackendBuilder withOptimizations(Collection<Optimizations> optimizations) {
        this.optimizations.addAll(optimizations);
        return this;
    }

    public SQLiteBackendBuilder withConfig(FilterEngineConfig config) {
        this.config = config;
        return this;
    }

    public SQLiteBackendBuilder loadSpatialite(boolean loadSpatialite) {
        this.loadSpatialite = loadSpatialite;
        return this;
    }

    public SQLiteBackend build() {
        FilterEngineConfig config = this.config != null ? this.config : FilterEngineConfig.defaults();
        boolean spatialite = this.loadSpatialite;

        Function<String, SQLConnectionProvider> factory = this.connectionProvider != null
            ? this.connectionProvider
            : path -> new SQLiteConnectionProvider(path, spatialite, config.pool());

        BackendMetrics metrics = new BackendMetrics(SQLiteBackend.NAME);
        return new SQLiteBackend(metrics, new SpatiaLiteFilterExecutor(factory, optimizations, metrics, config));
    }
}
