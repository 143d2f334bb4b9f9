package io.github.flameyossnowy.geofilter.postgresql.credentials;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record PostgreSQLCredentials(@NotNull String host, int port, @NotNull String database, @NotNull String username, @NotNull String password) {
    public PostgreSQLCredentials {
        Objects.requireNonNull(host, "Host cannot be null");
        Objects.requireNonNull(database, "Database cannot be null");
        Objects.requireNonNull(username, "Username cannot be null");
        Objects.requireNonNull(password, "Password cannot be null");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
    }

    public PostgreSQLCredentials(@NotNull String host, @NotNull String database, @NotNull String username, @NotNull String password) {
        this(host, 5432, database, username, password);
    }

    public String jdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }

    /**
     * Identifies the store: two layers with the same key can be correlated in one query.
     */
    public String storeKey() {
        return "postgresql://" + host + ":" + port + "/" + database;
    }

    @Override
    public String toString() {
        return "PostgreSQLCredentials[" + username + "@" + storeKey() + "]";
    }
}
