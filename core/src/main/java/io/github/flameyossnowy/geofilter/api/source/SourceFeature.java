package io.github.flameyossnowy.geofilter.api.source;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One extracted source feature. Attribute values may be {@code null}.
 */
public record SourceFeature(@NotNull String wkt, @NotNull Map<String, Object> attributes) {
    public SourceFeature {
        Objects.requireNonNull(wkt, "Feature WKT cannot be null");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static SourceFeature of(String wkt) {
        return new SourceFeature(wkt, Map.of());
    }
}
