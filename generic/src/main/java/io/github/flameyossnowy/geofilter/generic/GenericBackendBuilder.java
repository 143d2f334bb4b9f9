package io.github.flameyossnowy.geofilter.generic;

import io.github.flameyossnowy.geofilter.api.backend.BackendMetrics;
import io.github.flameyossnowy.geofilter.api.engine.FilterEngineConfig;
import io.github.flameyossnowy.geofilter.generic.features.FeatureSource;
import io.github.flameyossnowy.geofilter.generic.features.GeoJsonFeatureSource;

public class GenericBackendBuilder {
    private FeatureSource featureSource;
    private FilterEngineConfig config;

    /**
     * Where layer features come from. Defaults to reading each layer's source as a GeoJSON file.
     */
    public GenericBackendBuilder withFeatureSource(FeatureSource featureSource) {
        this.featureSource = featureSource;
        return this;
    }

    public GenericBackendBuilder withConfig(FilterEngineConfig config) {
        this.config = config;
        return this;
    }

    public GenericBackend build() {
        FeatureSource source = featureSource != null ? featureSource : new GeoJsonFeatureSource();
        FilterEngineConfig config = this.config != null ? this.config : FilterEngineConfig.defaults();
        BackendMetrics metrics = new BackendMetrics(GenericBackend.NAME);
        return new GenericBackend(metrics, new GenericFormatFilterExecutor(source, metrics, config));
    }
}
