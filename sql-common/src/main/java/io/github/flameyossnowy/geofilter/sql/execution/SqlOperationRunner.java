package io.github.flameyossnowy.geofilter.sql.execution;

import io.github.flameyossnowy.geofilter.api.exceptions.BackendConnectionException;
import io.github.flameyossnowy.geofilter.api.exceptions.FilterExecutionException;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import io.github.flameyossnowy.geofilter.sql.SQLConnectionProvider;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs one unit of JDBC work on a freshly checked-out connection.
 * A connection failure is retried once on a new connection; anything else is surfaced
 * with the driver's message.
 */
public final class SqlOperationRunner {
    private final String backendName;

    public SqlOperationRunner(@NotNull String backendName) {
        this.backendName = backendName;
    }

    public String backendName() {
        return backendName;
    }

    public <R> R run(@NotNull SQLConnectionProvider provider, @NotNull String operation, @NotNull SqlWork<R> work) {
        try {
            return runOnce(provider, work);
        } catch (SQLException first) {
            if (!SqlErrors.isConnectionError(first)) {
                throw executionError(operation, first);
            }

            Logging.warn("[" + backendName + "] connection failed during " + operation + ", retrying once: " + first.getMessage());
            try {
                return runOnce(provider, work);
            } catch (SQLException second) {
                second.addSuppressed(first);
                if (SqlErrors.isConnectionError(second)) {
                    throw new BackendConnectionException(
                        backendName,
                        backendName + " unreachable during " + operation + ": " + SqlErrors.nativeMessage(second),
                        second
                    );
                }
                throw executionError(operation, second);
            }
        }
    }

    private static <R> R runOnce(SQLConnectionProvider provider, SqlWork<R> work) throws SQLException {
        try (Connection connection = provider.getConnection()) {
            return work.run(connection);
        }
    }

    private FilterExecutionException executionError(String operation, SQLException exception) {
        return new FilterExecutionException(backendName, operation, SqlErrors.nativeMessage(exception), exception);
    }
}
