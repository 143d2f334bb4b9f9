package io.github.flameyossnowy.geofilter.api.cache;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record CacheKey(@NotNull String sessionId, @NotNull String layerId, @NotNull String fingerprint) {
    public CacheKey {
        Objects.requireNonNull(sessionId, "Session id cannot be null");
        Objects.requireNonNull(layerId, "Layer id cannot be null");
        Objects.requireNonNull(fingerprint, "Fingerprint cannot be null");
    }
}
