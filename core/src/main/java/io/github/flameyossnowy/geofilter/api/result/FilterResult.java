package io.github.flameyossnowy.geofilter.api.result;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of filtering one target layer.
 *
 * @param filterText subset definition to persist on the layer; {@code null} on failure,
 *                   in which case the layer keeps its previous subset
 */
public record FilterResult(
    @NotNull String layerId,
    @NotNull String backendName,
    boolean success,
    @NotNull List<Object> matchedIds,
    @Nullable String filterText,
    long executionTimeMillis,
    boolean usedOptimization,
    @Nullable String errorMessage
) {
    public FilterResult {
        Objects.requireNonNull(layerId, "Layer id cannot be null");
        Objects.requireNonNull(backendName, "Backend name cannot be null");
        matchedIds = List.copyOf(matchedIds);
        if (success && filterText == null) {
            throw new IllegalArgumentException("A successful result needs a filter text");
        }
    }

    public static FilterResult success(String layerId, String backendName, List<Object> matchedIds, String filterText, long executionTimeMillis, boolean usedOptimization) {
        return new FilterResult(layerId, backendName, true, matchedIds, filterText, executionTimeMillis, usedOptimization, null);
    }

    public static FilterResult failure(String layerId, String backendName, String errorMessage, long executionTimeMillis) {
        return new FilterResult(layerId, backendName, false, List.of(), null, executionTimeMillis, false, errorMessage);
    }

    public int matchedCount() {
        return matchedIds.size();
    }
}
