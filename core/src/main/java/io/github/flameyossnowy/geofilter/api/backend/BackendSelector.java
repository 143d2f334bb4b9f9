package io.github.flameyossnowy.geofilter.api.backend;

import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.layer.StorageKind;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Picks a backend per layer: an explicit override first, then the backend registered for
 * the layer's storage kind, then the fallback. Never fails.
 */
public final class BackendSelector {
    private final Map<StorageKind, FilterBackend> backends = new EnumMap<>(StorageKind.class);
    private final FilterBackend fallback;

    public BackendSelector(@NotNull FilterBackend fallback, @NotNull Collection<? extends FilterBackend> backends) {
        this.fallback = Objects.requireNonNull(fallback, "Fallback backend cannot be null");
        this.backends.put(fallback.storageKind(), fallback);
        for (FilterBackend backend : backends) {
            this.backends.put(backend.storageKind(), backend);
        }
    }

    public BackendSelector(@NotNull FilterBackend fallback, FilterBackend... backends) {
        this(fallback, List.of(backends));
    }

    @NotNull
    public FilterBackend select(@NotNull LayerInfo layer, @Nullable StorageKind override) {
        if (override != null) {
            FilterBackend forced = usable(override);
            if (forced != null) {
                Logging.info(() -> "Using forced backend " + forced.name() + " for layer " + layer.id());
                return forced;
            }
            Logging.warn("Forced backend " + override + " is not available for layer " + layer.id() + ", selecting by storage kind");
        }

        FilterBackend matched = usable(layer.storageKind());
        if (matched != null) {
            return matched;
        }

        Logging.info(() -> "No backend for " + layer.storageKind() + ", falling back to " + fallback.name() + " for layer " + layer.id());
        return fallback;
    }

    @NotNull
    public FilterBackend fallback() {
        return fallback;
    }

    public Collection<FilterBackend> backends() {
        return List.copyOf(backends.values());
    }

    @Nullable
    private FilterBackend usable(StorageKind kind) {
        FilterBackend backend = backends.get(kind);
        if (backend == null || !backend.supports(BackendCapability.SPATIAL_FILTER)) {
            return null;
        }
        return backend;
    }
}
