package io.github.flameyossnowy.geofilter.api.cache;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Spatial indexes already confirmed in this session, so repeated runs skip the catalog lookup.
 */
public final class IndexRegistry {
    private final Map<Key, String> indexes = new ConcurrentHashMap<>();

    public Optional<String> lookup(@Nullable String store, @NotNull String table, @NotNull String geometryColumn) {
        return Optional.ofNullable(indexes.get(new Key(store, table, geometryColumn)));
    }

    public void remember(@Nullable String store, @NotNull String table, @NotNull String geometryColumn, @NotNull String indexName) {
        indexes.put(new Key(store, table, geometryColumn), indexName);
    }

    public void forget(@Nullable String store, @NotNull String table) {
        indexes.keySet().removeIf(key -> key.table.equals(table) && Objects.equals(key.store, store));
    }

    public int size() {
        return indexes.size();
    }

    public void clear() {
        indexes.clear();
    }

    private record Key(String store, String table, String geometryColumn) {}
}
