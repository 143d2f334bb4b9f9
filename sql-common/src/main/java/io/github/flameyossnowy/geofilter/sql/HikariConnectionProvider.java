package io.github.flameyossnowy.geofilter.sql;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.flameyossnowy.geofilter.api.engine.FilterEngineConfig;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Pooled provider backed by HikariCP.
 * Connects lazily: no connection is opened before the first {@link #getConnection()}.
 */
public class HikariConnectionProvider implements SQLConnectionProvider {
    private final HikariDataSource dataSource;

    public HikariConnectionProvider(@NotNull HikariConfig config) {
        this.dataSource = new HikariDataSource(config);
        Logging.info(() -> "Opened connection pool " + config.getPoolName());
    }

    /**
     * Base pool configuration shared by every store.
     */
    public static HikariConfig baseConfig(@NotNull String poolName, @NotNull String jdbcUrl, @NotNull FilterEngineConfig.PoolSettings pool) {
        HikariConfig config = new HikariConfig();
        config.setPoolName(poolName);
        config.setJdbcUrl(jdbcUrl);
        config.setMinimumIdle(pool.minimumIdle());
        config.setMaximumPoolSize(pool.maximumPoolSize());
        config.setConnectionTimeout(pool.connectionTimeoutMillis());
        config.setIdleTimeout(pool.idleTimeoutMillis());
        // Do not fail pool construction when the store is down; the first checkout reports it.
        config.setInitializationFailTimeout(-1);
        return config;
    }

    @Override
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            Logging.info(() -> "Closing connection pool " + dataSource.getPoolName());
            dataSource.close();
        }
    }
}
