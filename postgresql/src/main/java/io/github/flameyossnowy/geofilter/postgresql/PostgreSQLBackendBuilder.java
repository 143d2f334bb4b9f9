package io.github.flameyossnowy.geofilter.postgresql;

import io.github.flameyossnowy.geofilter.api.backend.BackendMetrics;
import io.github.flameyossnowy.geofilter.api.backend.Optimizations;
import io.github.flameyossnowy.geofilter.api.engine.FilterEngineConfig;
import io.github.flameyossnowy.geofilter.postgresql.connections.PostgreSQLConnectionProvider;
import io.github.flameyossnowy.geofilter.postgresql.credentials.PostgreSQLCredentials;
import io.github.flameyossnowy.geofilter.sql.SQLConnectionProvider;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.function.Function;

@SuppressWarnings("unused")
public class PostgreSQLBackendBuilder {
    private PostgreSQLCredentials credentials;
    private Function<PostgreSQLCredentials, SQLConnectionProvider> connectionProvider;
    private final EnumSet<Optimizations> optimizations = EnumSet.noneOf(Optimizations.class);
    private FilterEngineConfig config;

    public PostgreSQLBackendBuilder withCredentials(PostgreSQLCredentials credentials) {
        this.credentials = credentials;
        return this;
    }

    public PostgreSQLBackendBuilder withConnectionProvider(Function<PostgreSQLCredentials, SQLConnectionProvider> connectionProvider) {
        this.connectionProvider = connectionProvider;
        return this;
    }

    public PostgreSQLBackendBuilder withOptimizations(Optimizations... optimizations) {
        Collections.addAll(this.optimizations, optimizations);
        return this;
    }

    public PostgreSQLBackendBuilder withOptimizations(Collection<Optimizations> optimizations) {
        this.optimizations.addAll(optimizations);
        return this;
    }

    public PostgreSQLBackendBuilder withConfig(FilterEngineConfig config) {
        this.config = config;
        return this;
    }

    public PostgreSQLBackend build() {
        if (this.credentials == null) throw new IllegalArgumentException("Credentials cannot be null");
        FilterEngineConfig config = this.config != null ? this.config : FilterEngineConfig.defaults();

        Function<PostgreSQLCredentials, SQLConnectionProvider> factory = this.connectionProvider != null
            ? this.connectionProvider
            : credentials -> new PostgreSQLConnectionProvider(credentials, config.pool());

        BackendMetrics metrics = new BackendMetrics(PostgreSQLBackend.NAME);
        PostgreSQLFilterExecutor executor = new PostgreSQLFilterExecutor(
            Objects.requireNonNull(credentials),
            factory,
            optimizations,
            metrics,
            config
        );
        return new PostgreSQLBackend(metrics, executor);
    }
}
