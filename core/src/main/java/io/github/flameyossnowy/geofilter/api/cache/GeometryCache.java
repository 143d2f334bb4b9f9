package io.github.flameyossnowy.geofilter.api.cache;

import io.github.flameyossnowy.geofilter.api.source.PreparedSource;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Session-scoped memo of parsed source geometries, so a multi-layer batch parses and
 * reprojects its source once. A miss is always recoverable by recomputing.
 */
public final class GeometryCache {
    private final Map<CacheKey, PreparedSource> entries = new ConcurrentHashMap<>();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public Optional<PreparedSource> get(@NotNull CacheKey key) {
        PreparedSource cached = entries.get(key);
        if (cached == null) {
            misses.increment();
            return Optional.empty();
        }

        hits.increment();
        Logging.deepInfo(() -> "Geometry cache hit for layer " + key.layerId());
        return Optional.of(cached);
    }

    public void put(@NotNull CacheKey key, @NotNull PreparedSource value) {
        entries.put(key, value);
    }

    public int invalidateLayer(@NotNull String layerId) {
        int before = entries.size();
        entries.keySet().removeIf(key -> key.layerId().equals(layerId));
        return before - entries.size();
    }

    public void invalidateSession() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public long hits() {
        return hits.sum();
    }

    public long misses() {
        return misses.sum();
    }
}
