package io.github.flameyossnowy.geofilter.api.backend;

import io.github.flameyossnowy.geofilter.api.result.FilterResult;
import org.jetbrains.annotations.NotNull;

/**
 * Runs a built expression against its store. The only place that blocks on I/O.
 */
public interface FilterExecutor {
    /**
     * @throws io.github.flameyossnowy.geofilter.api.exceptions.BackendConnectionException if the store stays unreachable after one retry
     * @throws io.github.flameyossnowy.geofilter.api.exceptions.FilterExecutionException if the store rejects the statement
     * @throws io.github.flameyossnowy.geofilter.api.exceptions.FilterCancelledException if cancelled while reading
     */
    @NotNull
    FilterResult execute(@NotNull ExecutionRequest request);
}
