package io.github.flameyossnowy.geofilter.sql.history;

import io.github.flameyossnowy.geofilter.api.history.HistoryEntry;
import io.github.flameyossnowy.geofilter.api.history.SubsetHistoryLog;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import io.github.flameyossnowy.geofilter.sql.SQLConnectionProvider;
import io.github.flameyossnowy.geofilter.sql.execution.SqlOperationRunner;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link SubsetHistoryLog} stored in a {@code fm_subset_history} table, created on first use.
 * Timestamps are epoch milliseconds so the same DDL works on every store.
 */
public final class JdbcSubsetHistoryLog implements SubsetHistoryLog {
    public static final String TABLE = "fm_subset_history";

    private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
        + "id VARCHAR(36) NOT NULL PRIMARY KEY, "
        + "_updated_at BIGINT NOT NULL, "
        + "fk_project VARCHAR(255) NOT NULL, "
        + "layer_id VARCHAR(255) NOT NULL, "
        + "layer_source_id VARCHAR(255), "
        + "seq_order INTEGER NOT NULL, "
        + "subset_string TEXT NOT NULL)";

    private static final String CREATE_INDEX = "CREATE INDEX IF NOT EXISTS idx_" + TABLE + "_layer ON " + TABLE + " (fk_project, layer_id, seq_order)";

    private static final String NEXT_SEQUENCE = "SELECT COALESCE(MAX(seq_order), 0) + 1 FROM " + TABLE + " WHERE fk_project = ? AND layer_id = ?";

    private static final String INSERT = "INSERT INTO " + TABLE
        + " (id, _updated_at, fk_project, layer_id, layer_source_id, seq_order, subset_string) VALUES (?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT = "SELECT id, _updated_at, fk_project, layer_id, layer_source_id, seq_order, subset_string FROM " + TABLE
        + " WHERE fk_project = ? AND layer_id = ? ORDER BY seq_order DESC";

    private static final String DELETE = "DELETE FROM " + TABLE + " WHERE fk_project = ? AND layer_id = ?";

    private final SQLConnectionProvider provider;
    private final SqlOperationRunner runner;
    private final Clock clock;
    private volatile boolean initialized;

    public JdbcSubsetHistoryLog(@NotNull SQLConnectionProvider provider) {
        this(provider, Clock.systemUTC());
    }

    public JdbcSubsetHistoryLog(@NotNull SQLConnectionProvider provider, @NotNull Clock clock) {
        this.provider = provider;
        this.runner = new SqlOperationRunner("history");
        this.clock = clock;
    }

    @NotNull
    @Override
    public synchronized HistoryEntry append(@NotNull String projectId, @NotNull String layerId, @Nullable String sourceLayerId, @NotNull String subset) {
        initialize();
        return runner.run(provider, "append subset history", connection -> {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                HistoryEntry entry = insert(connection, projectId, layerId, sourceLayerId, subset);
                connection.commit();
                return entry;
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        });
    }

    @Override
    public Optional<HistoryEntry> latest(@NotNull String projectId, @NotNull String layerId) {
        List<HistoryEntry> entries = query(projectId, layerId, 1);
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(0));
    }

    @Override
    public List<HistoryEntry> entries(@NotNull String projectId, @NotNull String layerId) {
        return query(projectId, layerId, Integer.MAX_VALUE);
    }

    @Override
    public int deleteLayer(@NotNull String projectId, @NotNull String layerId) {
        initialize();
        int deleted = runner.run(provider, "delete subset history", connection -> {
            try (PreparedStatement statement = provider.prepareStatement(DELETE, connection)) {
                statement.setString(1, projectId);
                statement.setString(2, layerId);
                return statement.executeUpdate();
            }
        });
        Logging.info(() -> "Deleted " + deleted + " history rows of layer " + layerId);
        return deleted;
    }

    private HistoryEntry insert(Connection connection, String projectId, String layerId, String sourceLayerId, String subset) throws SQLException {
        int sequence;
        try (PreparedStatement statement = provider.prepareStatement(NEXT_SEQUENCE, connection)) {
            statement.setString(1, projectId);
            statement.setString(2, layerId);
            try (ResultSet resultSet = statement.executeQuery()) {
                resultSet.next();
                sequence = resultSet.getInt(1);
            }
        }

        HistoryEntry entry = new HistoryEntry(UUID.randomUUID().toString(), projectId, layerId, sourceLayerId, sequence, subset, clock.instant());
        try (PreparedStatement statement = provider.prepareStatement(INSERT, connection)) {
            statement.setString(1, entry.id());
            statement.setLong(2, entry.updatedAt().toEpochMilli());
            statement.setString(3, projectId);
            statement.setString(4, layerId);
            statement.setString(5, sourceLayerId);
            statement.setInt(6, sequence);
            statement.setString(7, subset);
            statement.executeUpdate();
        }
        return entry;
    }

    private List<HistoryEntry> query(String projectId, String layerId, int limit) {
        initialize();
        return runner.run(provider, "read subset history", connection -> {
            List<HistoryEntry> entries = new ArrayList<>();
            try (PreparedStatement statement = provider.prepareStatement(SELECT, connection)) {
                statement.setString(1, projectId);
                statement.setString(2, layerId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next() && entries.size() < limit) {
                        entries.add(new HistoryEntry(
                            resultSet.getString(1),
                            resultSet.getString(3),
                            resultSet.getString(4),
                            resultSet.getString(5),
                            resultSet.getInt(6),
                            resultSet.getString(7),
                            Instant.ofEpochMilli(resultSet.getLong(2))
                        ));
                    }
                }
            }
            return entries;
        });
    }

    private void initialize() {
        if (initialized) {
            return;
        }

        synchronized (this) {
            if (initialized) {
                return;
            }
            runner.run(provider, "create subset history table", connection -> {
                try (Statement statement = connection.createStatement()) {
                    statement.executeUpdate(CREATE_TABLE);
                    statement.executeUpdate(CREATE_INDEX);
                }
                return null;
            });
            initialized = true;
        }
    }
}
