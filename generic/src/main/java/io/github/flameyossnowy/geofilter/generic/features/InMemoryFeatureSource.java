package io.github.flameyossnowy.geofilter.generic.features;

import io.github.flameyossnowy.geofilter.api.exceptions.FilterException;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Features registered by layer id, for hosts that already hold them in memory.
 */
public final class InMemoryFeatureSource implements FeatureSource {
    private final Map<String, List<Feature>> layers = new ConcurrentHashMap<>();

    public InMemoryFeatureSource register(@NotNull String layerId, @NotNull List<Feature> features) {
        layers.put(layerId, List.copyOf(features));
        return this;
    }

    public void unregister(@NotNull String layerId) {
        layers.remove(layerId);
    }

    @NotNull
    @Override
    public Iterable<Feature> features(@NotNull LayerInfo layer) {
        List<Feature> features = layers.get(layer.id());
        if (features == null) {
            throw new FilterException("No features registered for layer " + layer.id());
        }
        return features;
    }
}
