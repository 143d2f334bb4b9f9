package io.github.flameyossnowy.geofilter.api.engine;

import io.github.flameyossnowy.geofilter.api.buffer.BufferConfig;
import io.github.flameyossnowy.geofilter.api.expression.AttributeFilter;
import io.github.flameyossnowy.geofilter.api.layer.StorageKind;
import io.github.flameyossnowy.geofilter.api.predicate.CombineOperator;
import io.github.flameyossnowy.geofilter.api.predicate.PredicateSet;
import io.github.flameyossnowy.geofilter.api.source.SourceGeometry;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A declarative filter operation over several target layers.
 *
 * @param sourceLayerId         layer the source geometry was extracted from
 * @param source                extracted source geometry, {@code null} for attribute-only requests
 * @param predicates            spatial predicates
 * @param operator              how the predicate tests combine
 * @param buffer                buffer applied to the source
 * @param targetLayerIds        layers to filter, in order
 * @param backendOverrides      per-layer forced storage kind
 * @param useCentroids          test target centroids instead of full geometries
 * @param attributeFilter       attribute conditions ANDed with the spatial tests
 * @param existingSubsets       subsets currently active on target layers
 * @param subsetCombineOperator how a new filter combines with an existing subset, {@code null} to replace it
 */
public record FilterRequest(
    @NotNull String sourceLayerId,
    @Nullable SourceGeometry source,
    @NotNull PredicateSet predicates,
    @NotNull CombineOperator operator,
    @NotNull BufferConfig buffer,
    @NotNull List<String> targetLayerIds,
    @NotNull Map<String, StorageKind> backendOverrides,
    boolean useCentroids,
    @Nullable AttributeFilter attributeFilter,
    @NotNull Map<String, String> existingSubsets,
    @Nullable CombineOperator subsetCombineOperator
) {
    public FilterRequest {
        Objects.requireNonNull(sourceLayerId, "Source layer id cannot be null");
        Objects.requireNonNull(predicates, "Predicates cannot be null");
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(buffer, "Buffer cannot be null");
        targetLayerIds = List.copyOf(targetLayerIds);
        backendOverrides = Map.copyOf(backendOverrides);
        existingSubsets = Map.copyOf(existingSubsets);

        if (predicates.isEmpty() && attributeFilter == null) {
            throw new IllegalArgumentException("A filter request needs at least one predicate or an attribute filter");
        }
        if (!predicates.isEmpty() && source == null) {
            throw new IllegalArgumentException("Spatial predicates need a source geometry");
        }
    }

    public static Builder builder(@NotNull String sourceLayerId) {
        return new Builder(sourceLayerId);
    }

    @SuppressWarnings("unused")
    public static final class Builder {
        private final String sourceLayerId;
        private SourceGeometry source;
        private final List<String> predicates = new ArrayList<>();
        private CombineOperator operator = CombineOperator.OR;
        private BufferConfig buffer = BufferConfig.none();
        private final List<String> targetLayerIds = new ArrayList<>();
        private final Map<String, StorageKind> backendOverrides = new HashMap<>();
        private boolean useCentroids;
        private AttributeFilter attributeFilter;
        private final Map<String, String> existingSubsets = new LinkedHashMap<>();
        private CombineOperator subsetCombineOperator;

        private Builder(String sourceLayerId) {
            this.sourceLayerId = Objects.requireNonNull(sourceLayerId, "Source layer id cannot be null");
        }

        public Builder withSource(SourceGeometry source) {
            this.source = source;
            return this;
        }

        public Builder withPredicates(String... predicates) {
            Collections.addAll(this.predicates, predicates);
            return this;
        }

        public Builder withPredicates(Collection<String> predicates) {
            this.predicates.addAll(predicates);
            return this;
        }

        public Builder withOperator(CombineOperator operator) {
            this.operator = operator;
            return this;
        }

        public Builder withBuffer(BufferConfig buffer) {
            this.buffer = buffer;
            return this;
        }

        public Builder withTargets(String... layerIds) {
            Collections.addAll(this.targetLayerIds, layerIds);
            return this;
        }

        public Builder withTargets(Collection<String> layerIds) {
            this.targetLayerIds.addAll(layerIds);
            return this;
        }

        public Builder withBackendOverride(String layerId, StorageKind kind) {
            this.backendOverrides.put(layerId, kind);
            return this;
        }

        public Builder withCentroids(boolean useCentroids) {
            this.useCentroids = useCentroids;
            return this;
        }

        public Builder withAttributeFilter(AttributeFilter attributeFilter) {
            this.attributeFilter = attributeFilter;
            return this;
        }

        public Builder withExistingSubset(String layerId, String subset) {
            this.existingSubsets.put(layerId, subset);
            return this;
        }

        public Builder withSubsetCombineOperator(CombineOperator subsetCombineOperator) {
            this.subsetCombineOperator = subsetCombineOperator;
            return this;
        }

        public FilterRequest build() {
            return new FilterRequest(
                sourceLayerId,
                source,
                PredicateSet.of(predicates),
                operator,
                buffer,
                targetLayerIds,
                backendOverrides,
                useCentroids,
                attributeFilter,
                existingSubsets,
                subsetCombineOperator
            );
        }
    }
}
