package io.github.flameyossnowy.geofilter.sql.execution;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;

public final class SqlErrors {
    private SqlErrors() {}

    /**
     * Whether the failure is about reaching the store rather than about the statement:
     * SQLState class {@code 08} or one of the JDBC connection exception types, anywhere in the chain.
     */
    public static boolean isConnectionError(SQLException exception) {
        Throwable current = exception;
        while (current != null) {
            if (current instanceof SQLTransientConnectionException || current instanceof SQLNonTransientConnectionException) {
                return true;
            }
            if (current instanceof SQLException sql) {
                String state = sql.getSQLState();
                if (state != null && state.startsWith("08")) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }

    public static String nativeMessage(SQLException exception) {
        String message = exception.getMessage();
        return message == null ? exception.getClass().getSimpleName() : message;
    }
}
