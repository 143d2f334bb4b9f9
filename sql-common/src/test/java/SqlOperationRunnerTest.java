import io.github.flameyossnowy.geofilter.api.exceptions.BackendConnectionException;
import io.github.flameyossnowy.geofilter.api.exceptions.FilterExecutionException;
import io.github.flameyossnowy.geofilter.sql.SQLConnectionProvider;
import io.github.flameyossnowy.geofilter.sql.execution.SqlOperationRunner;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SqlOperationRunnerTest {
    final SqlOperationRunner runner = new SqlOperationRunner("test");

    @Test
    void connection_failure_is_retried_once() {
        FlakyProvider provider = new FlakyProvider(1);

        int value = runner.run(provider, "select one", connection -> {
            try (Statement statement = connection.createStatement();
                 ResultSet resultSet = statement.executeQuery("SELECT 1")) {
                resultSet.next();
                return resultSet.getInt(1);
            }
        });

        assertEquals(1, value);
        assertEquals(2, provider.attempts.get());
    }

    @Test
    void second_connection_failure_is_reported_as_unreachable() {
        FlakyProvider provider = new FlakyProvider(2);

        BackendConnectionException failure = assertThrows(BackendConnectionException.class,
            () -> runner.run(provider, "select one", connection -> 1));
        assertEquals("test", failure.getBackendName());
        assertEquals(2, provider.attempts.get());
    }

    @Test
    void statement_errors_are_not_retried_and_keep_the_native_message() {
        FlakyProvider provider = new FlakyProvider(0);

        FilterExecutionException failure = assertThrows(FilterExecutionException.class,
            () -> runner.run(provider, "broken query", connection -> {
                try (Statement statement = connection.createStatement()) {
                    return statement.executeQuery("SELEC 1").next();
                }
            }));

        assertEquals(1, provider.attempts.get());
        assertEquals("broken query", failure.getOperation());
        assertTrue(failure.getNativeMessage().contains("syntax error"), failure.getNativeMessage());
    }

    static final class FlakyProvider implements SQLConnectionProvider {
        final AtomicInteger attempts = new AtomicInteger();
        private final int failures;

        FlakyProvider(int failures) {
            this.failures = failures;
        }

        @Override
        public Connection getConnection() throws SQLException {
            if (attempts.incrementAndGet() <= failures) {
                throw new SQLNonTransientConnectionException("Connection refused", "08001");
            }
            return DriverManager.getConnection("jdbc:sqlite::memory:");
        }

        @Override
        public void close() {}
    }
}
