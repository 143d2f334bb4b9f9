package io.github.flameyossnowy.geofilter.postgresql;

import io.github.flameyossnowy.geofilter.api.cache.Fingerprints;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.sql.execution.SqlOperationRunner;
import io.github.flameyossnowy.geofilter.sql.execution.SqlSpatialIndexManager;
import io.github.flameyossnowy.geofilter.sql.query.SqlIdentifiers;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * GiST indexes on PostGIS geometry columns.
 */
public final class PostGisSpatialIndexManager extends SqlSpatialIndexManager {
    static final String DEFAULT_SCHEMA = "public";
    private static final int MAX_IDENTIFIER_LENGTH = 63;

    private static final String FIND_SQL = "SELECT indexname, indexdef FROM pg_indexes WHERE schemaname = ? AND tablename = ? AND indexdef ILIKE '%USING gist%'";

    public PostGisSpatialIndexManager(SqlOperationRunner runner) {
        super(runner);
    }

    @Override
    protected Optional<String> findIndex(Connection connection, LayerInfo layer) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(FIND_SQL)) {
            statement.setString(1, schema(layer));
            statement.setString(2, layer.table());
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    String definition = resultSet.getString(2);
                    if (definition != null && coversColumn(definition, layer.geometryColumn())) {
                        return Optional.of(resultSet.getString(1));
                    }
                }
            }
        }
        return Optional.empty();
    }

    @Override
    protected String createIndex(Connection connection, LayerInfo layer) throws SQLException {
        String name = indexName(layer);
        String table = SqlIdentifiers.qualified(schema(layer), layer.table());
        try (Statement statement = connection.createStatement()) {
            statement.execute("CREATE INDEX IF NOT EXISTS " + SqlIdentifiers.quote(name) + " ON " + table
                + " USING GIST (" + SqlIdentifiers.quote(layer.geometryColumn()) + ")");
            statement.execute("ANALYZE " + table);
        }
        return name;
    }

    static String indexName(LayerInfo layer) {
        String name = layer.table() + "_" + layer.geometryColumn() + "_gist";
        if (name.length() <= MAX_IDENTIFIER_LENGTH) {
            return name;
        }
        return "idx_" + Fingerprints.md5(schema(layer), layer.table(), layer.geometryColumn()).substring(0, 16) + "_gist";
    }

    private static boolean coversColumn(String definition, String column) {
        return definition.contains("(" + column + ")") || definition.contains("(" + SqlIdentifiers.quote(column) + ")");
    }

    private static String schema(LayerInfo layer) {
        return layer.schema() == null ? DEFAULT_SCHEMA : layer.schema();
    }
}
