package io.github.flameyossnowy.geofilter.sql.execution;

import io.github.flameyossnowy.geofilter.api.cache.IndexRegistry;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.session.FilterSession;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import io.github.flameyossnowy.geofilter.sql.SQLConnectionProvider;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Makes sure a spatial index exists on a layer's geometry column before it is filtered.
 * Check-then-create, so calling it on every run is cheap once the session has seen the index.
 */
public abstract class SqlSpatialIndexManager {
    protected final SqlOperationRunner runner;

    protected SqlSpatialIndexManager(SqlOperationRunner runner) {
        this.runner = runner;
    }

    /**
     * @return the name of the existing or newly created index
     */
    public String ensureIndex(@NotNull FilterSession session, @NotNull SQLConnectionProvider provider, @NotNull LayerInfo layer) {
        IndexRegistry registry = session.indexRegistry();
        String table = qualifiedTable(layer);
        Optional<String> known = registry.lookup(layer.source(), table, layer.geometryColumn());
        if (known.isPresent()) {
            return known.get();
        }

        String indexName = runner.run(provider, "ensure spatial index on " + table, connection -> {
            Optional<String> existing = findIndex(connection, layer);
            if (existing.isPresent()) {
                Logging.deepInfo(() -> "Spatial index " + existing.get() + " already present on " + table);
                return existing.get();
            }

            String created = createIndex(connection, layer);
            Logging.info(() -> "Created spatial index " + created + " on " + table + "(" + layer.geometryColumn() + ")");
            return created;
        });

        registry.remember(layer.source(), table, layer.geometryColumn(), indexName);
        return indexName;
    }

    protected String qualifiedTable(LayerInfo layer) {
        return layer.schema() == null ? layer.table() : layer.schema() + "." + layer.table();
    }

    protected abstract Optional<String> findIndex(Connection connection, LayerInfo layer) throws SQLException;

    protected abstract String createIndex(Connection connection, LayerInfo layer) throws SQLException;
}
