package io.github.flameyossnowy.geofilter.api.engine;

import io.github.flameyossnowy.geofilter.api.result.FilterResult;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * Per-layer results of one batch, in target order.
 */
public record FilterOutcome(@NotNull List<FilterResult> results, boolean cancelled) {
    public enum Status {
        COMPLETE,
        PARTIAL,
        FAILED,
        CANCELLED
    }

    public FilterOutcome {
        results = List.copyOf(results);
    }

    public Status status() {
        if (cancelled) {
            return Status.CANCELLED;
        }

        long succeeded = results.stream().filter(FilterResult::success).count();
        if (succeeded == results.size()) {
            return Status.COMPLETE;
        }
        return succeeded == 0 ? Status.FAILED : Status.PARTIAL;
    }

    public List<FilterResult> succeeded() {
        return results.stream().filter(FilterResult::success).toList();
    }

    public List<FilterResult> failed() {
        return results.stream().filter(result -> !result.success()).toList();
    }

    public Optional<FilterResult> result(String layerId) {
        return results.stream().filter(result -> result.layerId().equals(layerId)).findFirst();
    }
}
