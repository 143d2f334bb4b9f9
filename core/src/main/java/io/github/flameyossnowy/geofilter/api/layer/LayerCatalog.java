package io.github.flameyossnowy.geofilter.api.layer;

import java.util.Optional;

/**
 * Layer-introspection collaborator. The engine only reads from it.
 */
@FunctionalInterface
public interface LayerCatalog {
    Optional<LayerInfo> describe(String layerId);
}
