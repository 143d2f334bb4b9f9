package io.github.flameyossnowy.geofilter.sql.execution;

import io.github.flameyossnowy.geofilter.api.backend.BackendMetrics;
import io.github.flameyossnowy.geofilter.api.backend.ExecutionRequest;
import io.github.flameyossnowy.geofilter.api.backend.FilterExecutor;
import io.github.flameyossnowy.geofilter.api.engine.FilterEngineConfig;
import io.github.flameyossnowy.geofilter.api.exceptions.FilterException;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.layer.PrimaryKeyDescriptor;
import io.github.flameyossnowy.geofilter.api.result.FilterResult;
import io.github.flameyossnowy.geofilter.api.session.CancellationToken;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import io.github.flameyossnowy.geofilter.sql.SQLConnectionProvider;
import io.github.flameyossnowy.geofilter.sql.query.SqlIdentifiers;
import org.jetbrains.annotations.NotNull;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Executes a built SQL filter by selecting the matching primary keys of the target.
 * <p>
 * Rows are read in pages of {@code fetchSize}; the cancellation flag is checked before the
 * statement runs and every {@code cancellationCheckInterval} rows. A cancelled read returns
 * nothing, so the caller keeps the layer's previous subset.
 */
public abstract class AbstractSqlFilterExecutor implements FilterExecutor {
    protected final String backendName;
    protected final BackendMetrics metrics;
    protected final FilterEngineConfig config;
    protected final SqlOperationRunner runner;

    protected AbstractSqlFilterExecutor(String backendName, BackendMetrics metrics, FilterEngineConfig config) {
        this.backendName = backendName;
        this.metrics = metrics;
        this.config = config;
        this.runner = new SqlOperationRunner(backendName);
    }

    @NotNull
    @Override
    public FilterResult execute(@NotNull ExecutionRequest request) {
        long start = System.nanoTime();
        LayerInfo target = request.target();
        SQLConnectionProvider provider = connectionProvider(request);

        beforeExecute(request, provider);

        PlannedQuery plan = plan(request, provider);
        Logging.info(() -> "[" + backendName + "] filtering " + target.id() + ": " + plan.selectSql());

        List<Object> ids = runner.run(provider, "select matching features of " + target.name(),
            connection -> {
                try (PreparedStatement statement = provider.prepareStatement(plan.selectSql(), connection)) {
                    return readIds(statement, target.primaryKey(), request.cancellation());
                }
            });

        long elapsed = System.nanoTime() - start;
        metrics.recordExecution(elapsed, plan.optimized());
        Logging.info(() -> "[" + backendName + "] " + target.id() + " matched " + ids.size() + " features in "
            + TimeUnit.NANOSECONDS.toMillis(elapsed) + " ms" + (plan.optimized() ? " (materialized)" : ""));

        return FilterResult.success(target.id(), backendName, ids, plan.filterText(), TimeUnit.NANOSECONDS.toMillis(elapsed), plan.optimized());
    }

    /**
     * Provider for the target's store, owned by the request's session.
     */
    protected abstract SQLConnectionProvider connectionProvider(ExecutionRequest request);

    /**
     * Runs before the filter statement, e.g. to ensure a spatial index. Failures here are
     * logged and do not stop the filter, which is still correct without an index.
     */
    protected void beforeExecute(ExecutionRequest request, SQLConnectionProvider provider) {
        if (!request.built().expression().spatial()) {
            return;
        }

        try {
            ensureIndex(request, provider);
        } catch (FilterException e) {
            Logging.warn("[" + backendName + "] could not ensure a spatial index on " + request.target().name() + ": " + e.getMessage());
        }
    }

    protected abstract void ensureIndex(ExecutionRequest request, SQLConnectionProvider provider);

    /**
     * Direct execution: the built expression is both the query predicate and the subset.
     */
    protected PlannedQuery plan(ExecutionRequest request, SQLConnectionProvider provider) {
        String filter = request.built().raw();
        return new PlannedQuery(selectIds(request.target(), filter), filter, false);
    }

    protected String selectIds(LayerInfo target, String filter) {
        return "SELECT " + SqlIdentifiers.quote(target.primaryKey().name())
            + " FROM " + SqlIdentifiers.qualified(target.schema(), target.table())
            + " WHERE " + filter;
    }

    private List<Object> readIds(PreparedStatement statement, PrimaryKeyDescriptor primaryKey, CancellationToken cancellation) throws SQLException {
        cancellation.throwIfCancelled("query of " + backendName);
        statement.setFetchSize(config.fetchSize());

        List<Object> ids = new ArrayList<>();
        int interval = config.cancellationCheckInterval();
        try (ResultSet resultSet = statement.executeQuery()) {
            while (resultSet.next()) {
                ids.add(primaryKey.normalize(resultSet.getObject(1)));
                if (ids.size() % interval == 0) {
                    cancellation.throwIfCancelled("read of " + backendName + " results");
                }
            }
        }
        return ids;
    }

    /**
     * @param selectSql  statement returning the matched primary keys
     * @param filterText subset definition handed back to the host
     * @param optimized  whether a materialized result set served the query
     */
    public record PlannedQuery(String selectSql, String filterText, boolean optimized) {}
}
