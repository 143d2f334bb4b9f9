package io.github.flameyossnowy.geofilter.sqlite;

import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.sql.execution.SqlOperationRunner;
import io.github.flameyossnowy.geofilter.sql.execution.SqlSpatialIndexManager;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * R-tree indexes: {@code CreateSpatialIndex} for SpatiaLite tables,
 * {@code gpkgAddSpatialIndex} for GeoPackage layers.
 */
public final class SpatiaLiteSpatialIndexManager extends SqlSpatialIndexManager {
    private static final String SPATIALITE_ENABLED_SQL = "SELECT spatial_index_enabled FROM geometry_columns "
        + "WHERE lower(f_table_name) = lower(?) AND lower(f_geometry_column) = lower(?)";

    private static final String TABLE_EXISTS_SQL = "SELECT name FROM sqlite_master WHERE type = 'table' AND name = ?";

    public SpatiaLiteSpatialIndexManager(SqlOperationRunner runner) {
        super(runner);
    }

    @Override
    protected Optional<String> findIndex(Connection connection, LayerInfo layer) throws SQLException {
        if (layer.isGeoPackage()) {
            String rtree = geoPackageIndexName(layer);
            try (PreparedStatement statement = connection.prepareStatement(TABLE_EXISTS_SQL)) {
                statement.setString(1, rtree);
                try (ResultSet resultSet = statement.executeQuery()) {
                    return resultSet.next() ? Optional.of(rtree) : Optional.empty();
                }
            }
        }

        try (PreparedStatement statement = connection.prepareStatement(SPATIALITE_ENABLED_SQL)) {
            statement.setString(1, layer.table());
            statement.setString(2, layer.geometryColumn());
            try (ResultSet resultSet = statement.executeQuery()) {
                if (resultSet.next() && resultSet.getInt(1) == 1) {
                    return Optional.of(spatialiteIndexName(layer));
                }
            }
        }
        return Optional.empty();
    }

    @Override
    protected String createIndex(Connection connection, LayerInfo layer) throws SQLException {
        boolean geoPackage = layer.isGeoPackage();
        String function = geoPackage ? "gpkgAddSpatialIndex" : "CreateSpatialIndex";
        try (PreparedStatement statement = connection.prepareStatement("SELECT " + function + "(?, ?)")) {
            statement.setString(1, layer.table());
            statement.setString(2, layer.geometryColumn());
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!geoPackage && (!resultSet.next() || resultSet.getInt(1) != 1)) {
                    throw new SQLException("CreateSpatialIndex refused " + layer.table() + "." + layer.geometryColumn());
                }
            }
        }
        return geoPackage ? geoPackageIndexName(layer) : spatialiteIndexName(layer);
    }

    static String spatialiteIndexName(LayerInfo layer) {
        return "idx_" + layer.table() + "_" + layer.geometryColumn();
    }

    static String geoPackageIndexName(LayerInfo layer) {
        return "rtree_" + layer.table() + "_" + layer.geometryColumn();
    }
}
