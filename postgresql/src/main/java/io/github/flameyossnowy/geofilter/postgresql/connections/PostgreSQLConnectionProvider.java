package io.github.flameyossnowy.geofilter.postgresql.connections;

import com.zaxxer.hikari.HikariConfig;
import io.github.flameyossnowy.geofilter.api.engine.FilterEngineConfig;
import io.github.flameyossnowy.geofilter.postgresql.credentials.PostgreSQLCredentials;
import io.github.flameyossnowy.geofilter.sql.HikariConnectionProvider;
import org.jetbrains.annotations.NotNull;

public class PostgreSQLConnectionProvider extends HikariConnectionProvider {
    public PostgreSQLConnectionProvider(@NotNull PostgreSQLCredentials credentials, @NotNull FilterEngineConfig.PoolSettings pool) {
        super(config(credentials, pool));
    }

    private static HikariConfig config(PostgreSQLCredentials credentials, FilterEngineConfig.PoolSettings pool) {
        HikariConfig config = HikariConnectionProvider.baseConfig("geofilter-postgresql-" + credentials.database(), credentials.jdbcUrl(), pool);
        config.setDriverClassName("org.postgresql.Driver");
        config.setUsername(credentials.username());
        config.setPassword(credentials.password());
        config.addDataSourceProperty("ApplicationName", "geofilter");
        config.addDataSourceProperty("prepareThreshold", "3");
        return config;
    }
}
