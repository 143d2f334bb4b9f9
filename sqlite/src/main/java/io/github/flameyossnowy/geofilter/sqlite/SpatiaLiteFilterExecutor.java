package io.github.flameyossnowy.geofilter.sqlite;

import io.github.flameyossnowy.geofilter.api.backend.BackendMetrics;
import io.github.flameyossnowy.geofilter.api.backend.ExecutionRequest;
import io.github.flameyossnowy.geofilter.api.backend.Optimizations;
import io.github.flameyossnowy.geofilter.api.engine.FilterEngineConfig;
import io.github.flameyossnowy.geofilter.api.exceptions.FilterException;
import io.github.flameyossnowy.geofilter.sql.SQLConnectionProvider;
import io.github.flameyossnowy.geofilter.sql.SessionConnectionPools;
import io.github.flameyossnowy.geofilter.sql.execution.AbstractSqlFilterExecutor;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Function;

public final class SpatiaLiteFilterExecutor extends AbstractSqlFilterExecutor {
    private final Function<String, SQLConnectionProvider> connectionFactory;
    private final Set<Optimizations> optimizations;
    private final SpatiaLiteSpatialIndexManager indexManager;

    public SpatiaLiteFilterExecutor(
        Function<String, SQLConnectionProvider> connectionFactory,
        Set<Optimizations> optimizations,
        BackendMetrics metrics,
        FilterEngineConfig config
    ) {
        super(SQLiteBackend.NAME, metrics, config);
        this.connectionFactory = connectionFactory;
        this.optimizations = optimizations.isEmpty() ? EnumSet.noneOf(Optimizations.class) : EnumSet.copyOf(optimizations);
        this.indexManager = new SpatiaLiteSpatialIndexManager(runner);
    }

    @Override
    protected SQLConnectionProvider connectionProvider(ExecutionRequest request) {
        String path = request.target().source();
        if (path == null) {
            throw new FilterException("Layer " + request.target().id() + " has no database file");
        }
        return SessionConnectionPools.of(request.session()).provider("sqlite:" + path, () -> connectionFactory.apply(path));
    }

    @Override
    protected void ensureIndex(ExecutionRequest request, SQLConnectionProvider provider) {
        if (optimizations.contains(Optimizations.SPATIAL_INDEXES)) {
            indexManager.ensureIndex(request.session(), provider, request.target());
        }
    }
}
