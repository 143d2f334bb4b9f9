package io.github.flameyossnowy.geofilter.api.session;

import io.github.flameyossnowy.geofilter.api.cache.GeometryCache;
import io.github.flameyossnowy.geofilter.api.cache.IndexRegistry;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Owns every piece of mutable state shared by the filter operations of one host session:
 * the geometry cache, the index registry and typed resources such as connection pools
 * and materialized result sets. Closing the session tears all of them down.
 */
public final class FilterSession implements AutoCloseable {
    private final String id;
    private final GeometryCache geometryCache = new GeometryCache();
    private final IndexRegistry indexRegistry = new IndexRegistry();
    private final Map<Class<?>, SessionResource> resources = new LinkedHashMap<>();
    private volatile boolean closed;

    public FilterSession() {
        this(UUID.randomUUID().toString().replace("-", "").substring(0, 8));
    }

    public FilterSession(@NotNull String id) {
        Objects.requireNonNull(id, "Session id cannot be null");
        if (!id.matches("[A-Za-z0-9_]+")) {
            throw new IllegalArgumentException("Session id must be alphanumeric: " + id);
        }
        this.id = id;
    }

    public String id() {
        return id;
    }

    public GeometryCache geometryCache() {
        ensureOpen();
        return geometryCache;
    }

    public IndexRegistry indexRegistry() {
        ensureOpen();
        return indexRegistry;
    }

    /**
     * Returns the session's resource of the given type, creating it on first use.
     */
    public synchronized <R extends SessionResource> R resource(@NotNull Class<R> type, @NotNull Supplier<R> factory) {
        ensureOpen();
        SessionResource existing = resources.get(type);
        if (existing != null) {
            return type.cast(existing);
        }

        R created = Objects.requireNonNull(factory.get(), "Session resource factory returned null");
        resources.put(type, created);
        return created;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes resources in reverse creation order. Every resource is closed even if an earlier
     * one fails; the first failure is rethrown with the rest suppressed.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;

        List<SessionResource> ordered = new ArrayList<>(resources.values());
        resources.clear();

        RuntimeException failure = null;
        for (int i = ordered.size() - 1; i >= 0; i--) {
            try {
                ordered.get(i).close();
            } catch (RuntimeException e) {
                Logging.error("Failed to close session resource " + ordered.get(i).getClass().getSimpleName() + " of session " + id, e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }

        geometryCache.invalidateSession();
        indexRegistry.clear();
        Logging.info(() -> "Closed filter session " + id);

        if (failure != null) {
            throw failure;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Filter session " + id + " is closed");
        }
    }
}
