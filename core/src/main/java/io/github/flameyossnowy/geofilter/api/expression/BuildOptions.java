package io.github.flameyossnowy.geofilter.api.expression;

import io.github.flameyossnowy.geofilter.api.layer.CrsSupport;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * @param useCentroids         test the target's centroid instead of its full geometry
 * @param centroidMode         which centroid to use
 * @param attributeFilter      optional attribute conditions ANDed with the spatial tests
 * @param metricSrid           projected CRS geographic sources are buffered in
 * @param simplifyWktThreshold literal sources with longer WKT are simplified before buffering, {@code 0} disables
 */
public record BuildOptions(
    boolean useCentroids,
    @NotNull CentroidMode centroidMode,
    @Nullable AttributeFilter attributeFilter,
    int metricSrid,
    int simplifyWktThreshold
) {
    private static final BuildOptions DEFAULTS = new BuildOptions(false, CentroidMode.POINT_ON_SURFACE, null, CrsSupport.WEB_MERCATOR, 0);

    public BuildOptions {
        Objects.requireNonNull(centroidMode, "Centroid mode cannot be null");
        if (CrsSupport.isGeographic(metricSrid)) {
            throw new IllegalArgumentException("Metric CRS cannot be geographic: EPSG:" + metricSrid);
        }
    }

    public static BuildOptions defaults() {
        return DEFAULTS;
    }

    public BuildOptions withCentroids(boolean useCentroids) {
        return new BuildOptions(useCentroids, centroidMode, attributeFilter, metricSrid, simplifyWktThreshold);
    }

    public BuildOptions withAttributeFilter(@Nullable AttributeFilter attributeFilter) {
        return new BuildOptions(useCentroids, centroidMode, attributeFilter, metricSrid, simplifyWktThreshold);
    }
}
