package io.github.flameyossnowy.geofilter.api.source;

import org.jetbrains.annotations.NotNull;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryCollection;

import java.util.List;

/**
 * Parsed and combined source geometry, as held by the geometry cache.
 *
 * @param geometry     all source features combined into one geometry
 * @param wkt          WKT of {@code geometry}
 * @param srid         CRS of the geometry
 * @param features     the individual features, kept for per-feature buffers
 * @param fingerprint  digest of the inputs this was prepared from
 */
public record PreparedSource(
    @NotNull Geometry geometry,
    @NotNull String wkt,
    int srid,
    @NotNull List<SourceFeature> features,
    @NotNull String fingerprint
) {
    public PreparedSource {
        features = List.copyOf(features);
    }

    public int featureCount() {
        return features.size();
    }

    /**
     * A heterogeneous collection, as opposed to a homogeneous multi-geometry.
     */
    public boolean mixedCollection() {
        return geometry.getClass() == GeometryCollection.class;
    }
}
