package io.github.flameyossnowy.geofilter.api.source;

import io.github.flameyossnowy.geofilter.api.layer.CrsSupport;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Source geometry extracted by the host.
 *
 * @param features     selected source features
 * @param crsCode      CRS of the feature geometries
 * @param layer        metadata of the source layer, when it lives in a store a correlated subquery can reach
 * @param sourceFilter subset already active on the source layer, carried into correlated subqueries
 */
public record SourceGeometry(
    @NotNull List<SourceFeature> features,
    @NotNull String crsCode,
    @Nullable LayerInfo layer,
    @Nullable String sourceFilter
) {
    public SourceGeometry {
        features = List.copyOf(features);
        Objects.requireNonNull(crsCode, "Source CRS cannot be null");
    }

    public static SourceGeometry of(String crsCode, String... wkts) {
        return new SourceGeometry(
            Arrays.stream(wkts).map(SourceFeature::of).toList(),
            crsCode,
            null,
            null
        );
    }

    public int srid() {
        return CrsSupport.srid(crsCode);
    }

    public boolean isEmpty() {
        return features.isEmpty();
    }

    public SourceGeometry withLayer(@Nullable LayerInfo layer, @Nullable String sourceFilter) {
        return new SourceGeometry(features, crsCode, layer, sourceFilter);
    }
}
