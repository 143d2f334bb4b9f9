package io.github.flameyossnowy.geofilter.generic.features;

import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import org.jetbrains.annotations.NotNull;

/**
 * Supplies the features of a layer to the in-process evaluator.
 */
@FunctionalInterface
public interface FeatureSource {
    /**
     * @throws io.github.flameyossnowy.geofilter.api.exceptions.FilterException if the layer cannot be read
     */
    @NotNull
    Iterable<Feature> features(@NotNull LayerInfo layer);
}
