package io.github.flameyossnowy.geofilter.postgresql.materialized;

import io.github.flameyossnowy.geofilter.api.backend.BackendMetrics;
import io.github.flameyossnowy.geofilter.api.cache.Fingerprints;
import io.github.flameyossnowy.geofilter.api.session.FilterSession;
import io.github.flameyossnowy.geofilter.api.session.SessionResource;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import io.github.flameyossnowy.geofilter.sql.SQLConnectionProvider;
import io.github.flameyossnowy.geofilter.sql.execution.SqlOperationRunner;
import io.github.flameyossnowy.geofilter.sql.query.SqlIdentifiers;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Session-scoped materialized result sets in a PostGIS store.
 * <p>
 * View names are {@code <prefix><session>_<md5(query)[0..12]>}, so an identical request in the
 * same session maps to the same view and is reused, and concurrent sessions never collide.
 * Creation of one name is serialized by a per-name lock; two operations racing on the same
 * query produce one view.
 */
public final class MaterializedResultSetManager implements SessionResource {
    private static final String EXISTS_SQL = "SELECT 1 FROM pg_matviews WHERE schemaname = ? AND matviewname = ?";

    private static final String STATISTICS_SQL = "SELECT c.reltuples::bigint, pg_relation_size(c.oid) FROM pg_class c "
        + "JOIN pg_namespace n ON n.oid = c.relnamespace WHERE n.nspname = ? AND c.relname = ?";

    private static final String SESSION_VIEWS_SQL = "SELECT matviewname FROM pg_matviews WHERE schemaname = ? AND matviewname LIKE ? ESCAPE '!'";

    private final String sessionId;
    private final String schema;
    private final String prefix;
    private final SqlOperationRunner runner;
    private final BackendMetrics metrics;
    private final Clock clock;

    private final Map<String, SQLConnectionProvider> stores = new ConcurrentHashMap<>();
    private final Map<String, MaterializedResultSet> handles = new ConcurrentHashMap<>();
    private final Map<String, Instant> refreshedAt = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    private final LongAdder created = new LongAdder();
    private final LongAdder reused = new LongAdder();
    private final LongAdder refreshed = new LongAdder();
    private final LongAdder dropped = new LongAdder();

    public MaterializedResultSetManager(
        @NotNull String sessionId,
        @NotNull String schema,
        @NotNull String prefix,
        @NotNull SqlOperationRunner runner,
        @NotNull BackendMetrics metrics,
        @NotNull Clock clock
    ) {
        this.sessionId = Objects.requireNonNull(sessionId, "Session id cannot be null");
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "Prefix cannot be null");
        this.runner = runner;
        this.metrics = metrics;
        this.clock = clock;
    }

    public static MaterializedResultSetManager of(@NotNull FilterSession session, @NotNull String schema, @NotNull String prefix, @NotNull SqlOperationRunner runner, @NotNull BackendMetrics metrics) {
        return session.resource(MaterializedResultSetManager.class,
            () -> new MaterializedResultSetManager(session.id(), schema, prefix, runner, metrics, Clock.systemUTC()));
    }

    public String viewName(@NotNull String query) {
        return prefix + sessionId + "_" + Fingerprints.md5(query).substring(0, 12);
    }

    /**
     * Returns the view materializing {@code query}, creating it (with a GiST index on
     * {@code geometryColumn} when given) unless this session already holds a live one.
     */
    public MaterializedResultSet create(
        @NotNull SQLConnectionProvider provider,
        @NotNull String storeKey,
        @NotNull String query,
        @NotNull String baseTable,
        @Nullable String geometryColumn
    ) {
        String name = viewName(query);
        synchronized (locks.computeIfAbsent(name, key -> new Object())) {
            stores.putIfAbsent(storeKey, provider);

            MaterializedResultSet existing = handles.get(name);
            if (existing != null && exists(existing)) {
                reused.increment();
                metrics.recordCacheHit();
                Logging.info(() -> "Reusing materialized result set " + existing.qualifiedName());
                return existing;
            }

            MaterializedResultSet handle = new MaterializedResultSet(storeKey, schema, name, baseTable);
            metrics.recordCacheMiss();
            runner.run(provider, "create materialized result set " + name, connection -> {
                try (Statement statement = connection.createStatement()) {
                    statement.execute("CREATE SCHEMA IF NOT EXISTS " + SqlIdentifiers.quote(schema));
                    statement.execute("CREATE MATERIALIZED VIEW IF NOT EXISTS " + handle.qualifiedName() + " AS " + query + " WITH DATA");
                    if (geometryColumn != null) {
                        statement.execute("CREATE INDEX IF NOT EXISTS " + SqlIdentifiers.quote(name + "_gist")
                            + " ON " + handle.qualifiedName() + " USING GIST (" + SqlIdentifiers.quote(geometryColumn) + ")");
                    }
                    statement.execute("ANALYZE " + handle.qualifiedName());
                }
                return null;
            });

            handles.put(name, handle);
            refreshedAt.put(name, clock.instant());
            created.increment();
            Logging.info(() -> "Created materialized result set " + handle.qualifiedName() + " from " + baseTable);
            return handle;
        }
    }

    public boolean exists(@NotNull MaterializedResultSet handle) {
        return runner.run(provider(handle), "check materialized result set " + handle.name(), connection -> {
            try (PreparedStatement statement = connection.prepareStatement(EXISTS_SQL)) {
                statement.setString(1, handle.schema());
                statement.setString(2, handle.name());
                try (ResultSet resultSet = statement.executeQuery()) {
                    return resultSet.next();
                }
            }
        });
    }

    public void refresh(@NotNull MaterializedResultSet handle) {
        refresh(handle, false);
    }

    /**
     * @param concurrently keep the view readable during the refresh; needs a unique index on the view
     */
    public void refresh(@NotNull MaterializedResultSet handle, boolean concurrently) {
        runner.run(provider(handle), "refresh materialized result set " + handle.name(), connection -> {
            try (Statement statement = connection.createStatement()) {
                statement.execute("REFRESH MATERIALIZED VIEW " + (concurrently ? "CONCURRENTLY " : "") + handle.qualifiedName());
            }
            return null;
        });
        refreshedAt.put(handle.name(), clock.instant());
        refreshed.increment();
    }

    public void drop(@NotNull MaterializedResultSet handle) {
        dropByName(provider(handle), handle.name());
    }

    public MaterializedResultSetStatistics statistics(@NotNull MaterializedResultSet handle) {
        return runner.run(provider(handle), "read statistics of " + handle.name(), connection -> {
            try (PreparedStatement statement = connection.prepareStatement(STATISTICS_SQL)) {
                statement.setString(1, handle.schema());
                statement.setString(2, handle.name());
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) {
                        throw new IllegalStateException("Materialized result set " + handle.qualifiedName() + " does not exist");
                    }
                    return new MaterializedResultSetStatistics(resultSet.getLong(1), resultSet.getLong(2), refreshedAt.get(handle.name()));
                }
            }
        });
    }

    /**
     * Views this session created and has not dropped.
     */
    public List<MaterializedResultSet> handles() {
        return List.copyOf(handles.values());
    }

    /**
     * Drops every view of this session in every store it touched, including views orphaned by an
     * earlier crash of the same session id.
     *
     * @return number of dropped views
     */
    public int cleanupSession() {
        int count = 0;
        for (Map.Entry<String, SQLConnectionProvider> store : stores.entrySet()) {
            SQLConnectionProvider provider = store.getValue();
            List<String> names = runner.run(provider, "list session materialized result sets", connection -> {
                List<String> found = new ArrayList<>();
                try (PreparedStatement statement = connection.prepareStatement(SESSION_VIEWS_SQL)) {
                    statement.setString(1, schema);
                    statement.setString(2, likeEscape(prefix + sessionId + "_") + "%");
                    try (ResultSet resultSet = statement.executeQuery()) {
                        while (resultSet.next()) {
                            found.add(resultSet.getString(1));
                        }
                    }
                }
                return found;
            });

            for (String name : names) {
                dropByName(provider, name);
                count++;
            }
        }

        handles.clear();
        int total = count;
        Logging.info(() -> "Cleaned up " + total + " materialized result sets of session " + sessionId);
        return count;
    }

    public long createdCount() {
        return created.sum();
    }

    public long reusedCount() {
        return reused.sum();
    }

    public long refreshedCount() {
        return refreshed.sum();
    }

    public long droppedCount() {
        return dropped.sum();
    }

    @Override
    public void close() {
        cleanupSession();
    }

    private void dropByName(SQLConnectionProvider provider, String name) {
        runner.run(provider, "drop materialized result set " + name, connection -> {
            try (Statement statement = connection.createStatement()) {
                statement.execute("DROP MATERIALIZED VIEW IF EXISTS " + SqlIdentifiers.qualified(schema, name) + " CASCADE");
            }
            return null;
        });
        handles.remove(name);
        refreshedAt.remove(name);
        dropped.increment();
    }

    private SQLConnectionProvider provider(MaterializedResultSet handle) {
        SQLConnectionProvider provider = stores.get(handle.storeKey());
        if (provider == null) {
            throw new IllegalArgumentException("Unknown store for materialized result set " + handle.name());
        }
        return provider;
    }

    private static String likeEscape(String value) {
        return value.replace("!", "!!").replace("_", "!_").replace("%", "!%");
    }
}
