package io.github.flameyossnowy.geofilter.sqlite.connections;

import com.zaxxer.hikari.HikariConfig;
import io.github.flameyossnowy.geofilter.api.engine.FilterEngineConfig;
import io.github.flameyossnowy.geofilter.sql.HikariConnectionProvider;
import org.jetbrains.annotations.NotNull;

/**
 * Pooled connections to a SQLite, SpatiaLite or GeoPackage file. With {@code loadSpatialite}
 * every new connection loads {@code mod_spatialite} before it is handed out.
 */
public class SQLiteConnectionProvider extends HikariConnectionProvider {
    public static final String SPATIALITE_EXTENSION = "mod_spatialite";

    public SQLiteConnectionProvider(@NotNull String databasePath, boolean loadSpatialite, @NotNull FilterEngineConfig.PoolSettings pool) {
        super(config(databasePath, loadSpatialite, pool));
    }

    private static HikariConfig config(String databasePath, boolean loadSpatialite, FilterEngineConfig.PoolSettings pool) {
        HikariConfig config = HikariConnectionProvider.baseConfig("geofilter-sqlite-" + databasePath.hashCode(), "jdbc:sqlite:" + databasePath, pool);
        config.setDriverClassName("org.sqlite.JDBC");
        config.addDataSourceProperty("busy_timeout", "5000");
        if (loadSpatialite) {
            config.addDataSourceProperty("enable_load_extension", "true");
            config.setConnectionInitSql("SELECT load_extension('" + SPATIALITE_EXTENSION + "')");
        }
        return config;
    }
}
