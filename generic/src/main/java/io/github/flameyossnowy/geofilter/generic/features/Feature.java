package io.github.flameyossnowy.geofilter.generic.features;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.locationtech.jts.geom.Geometry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One feature of a file-backed layer.
 *
 * @param id         primary key value, as reported in matched ids
 * @param geometry   geometry in the layer's CRS, {@code null} for features without one
 * @param attributes attribute values, may contain nulls
 */
public record Feature(@NotNull Object id, @Nullable Geometry geometry, @NotNull Map<String, Object> attributes) {
    public Feature {
        Objects.requireNonNull(id, "Feature id cannot be null");
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Feature of(@NotNull Object id, @Nullable Geometry geometry) {
        return new Feature(id, geometry, Map.of());
    }
}
