package io.github.flameyossnowy.geofilter.postgresql;

import io.github.flameyossnowy.geofilter.api.backend.BackendMetrics;
import io.github.flameyossnowy.geofilter.api.backend.ExecutionRequest;
import io.github.flameyossnowy.geofilter.api.backend.Optimizations;
import io.github.flameyossnowy.geofilter.api.engine.FilterEngineConfig;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.postgresql.credentials.PostgreSQLCredentials;
import io.github.flameyossnowy.geofilter.postgresql.materialized.MaterializedResultSet;
import io.github.flameyossnowy.geofilter.postgresql.materialized.MaterializedResultSetManager;
import io.github.flameyossnowy.geofilter.sql.SQLConnectionProvider;
import io.github.flameyossnowy.geofilter.sql.SessionConnectionPools;
import io.github.flameyossnowy.geofilter.sql.execution.AbstractSqlFilterExecutor;
import io.github.flameyossnowy.geofilter.sql.query.SqlIdentifiers;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Runs PostGIS filters. Targets at or above the materialization threshold are served from a
 * session-scoped materialized result set, and the returned subset selects keys from that view.
 */
public final class PostgreSQLFilterExecutor extends AbstractSqlFilterExecutor {
    private final PostgreSQLCredentials credentials;
    private final Function<PostgreSQLCredentials, SQLConnectionProvider> connectionFactory;
    private final Set<Optimizations> optimizations;
    private final PostGisSpatialIndexManager indexManager;

    public PostgreSQLFilterExecutor(
        PostgreSQLCredentials credentials,
        Function<PostgreSQLCredentials, SQLConnectionProvider> connectionFactory,
        Set<Optimizations> optimizations,
        BackendMetrics metrics,
        FilterEngineConfig config
    ) {
        super(PostgreSQLBackend.NAME, metrics, config);
        this.credentials = credentials;
        this.connectionFactory = connectionFactory;
        this.optimizations = optimizations.isEmpty() ? EnumSet.noneOf(Optimizations.class) : EnumSet.copyOf(optimizations);
        this.indexManager = new PostGisSpatialIndexManager(runner);
    }

    @Override
    protected SQLConnectionProvider connectionProvider(ExecutionRequest request) {
        return SessionConnectionPools.of(request.session()).provider(credentials.storeKey(), () -> connectionFactory.apply(credentials));
    }

    @Override
    protected void ensureIndex(ExecutionRequest request, SQLConnectionProvider provider) {
        if (optimizations.contains(Optimizations.SPATIAL_INDEXES)) {
            indexManager.ensureIndex(request.session(), provider, request.target());
        }
    }

    @Override
    protected PlannedQuery plan(ExecutionRequest request, SQLConnectionProvider provider) {
        LayerInfo target = request.target();
        if (!shouldMaterialize(request)) {
            return super.plan(request, provider);
        }

        String primaryKey = SqlIdentifiers.quote(target.primaryKey().name());
        String table = SqlIdentifiers.qualified(target.schema(), target.table());
        String query = "SELECT " + primaryKey + ", " + SqlIdentifiers.quote(target.geometryColumn())
            + " FROM " + table + " WHERE " + request.built().raw();

        MaterializedResultSetManager manager = MaterializedResultSetManager.of(
            request.session(), config.materializedViewSchema(), config.materializedViewPrefix(), runner, metrics);
        MaterializedResultSet view = manager.create(provider, credentials.storeKey(), query, table, target.geometryColumn());

        String keys = "SELECT " + primaryKey + " FROM " + view.qualifiedName();
        return new PlannedQuery(keys, primaryKey + " IN (" + keys + ")", true);
    }

    private boolean shouldMaterialize(ExecutionRequest request) {
        return optimizations.contains(Optimizations.MATERIALIZED_RESULT_SETS)
            && request.built().expression().spatial()
            && request.target().featureCount() >= config.materializationThreshold();
    }
}
