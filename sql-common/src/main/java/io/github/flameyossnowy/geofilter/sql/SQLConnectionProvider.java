package io.github.flameyossnowy.geofilter.sql;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Hands out connections to one store. A connection is checked out for exactly one
 * operation and closed (returned to the pool) right after.
 */
public interface SQLConnectionProvider extends AutoCloseable {
    Connection getConnection() throws SQLException;

    default PreparedStatement prepareStatement(String sql, Connection connection) throws SQLException {
        return connection.prepareStatement(sql);
    }

    @Override
    void close();
}
