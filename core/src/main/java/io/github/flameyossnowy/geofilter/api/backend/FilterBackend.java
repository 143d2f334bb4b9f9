package io.github.flameyossnowy.geofilter.api.backend;

import io.github.flameyossnowy.geofilter.api.expression.ExpressionBuilder;
import io.github.flameyossnowy.geofilter.api.layer.StorageKind;

import java.util.Set;

/**
 * A dialect's builder and executor, plus the metrics they share.
 */
public interface FilterBackend {
    String name();

    StorageKind storageKind();

    Set<BackendCapability> capabilities();

    ExpressionBuilder builder();

    FilterExecutor executor();

    BackendMetrics metrics();

    default boolean supports(BackendCapability capability) {
        return capabilities().contains(capability);
    }
}
