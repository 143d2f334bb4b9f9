package io.github.flameyossnowy.geofilter.api.engine;

import io.github.flameyossnowy.geofilter.api.backend.BackendSelector;
import io.github.flameyossnowy.geofilter.api.backend.ExecutionRequest;
import io.github.flameyossnowy.geofilter.api.backend.FilterBackend;
import io.github.flameyossnowy.geofilter.api.buffer.BufferConfig;
import io.github.flameyossnowy.geofilter.api.exceptions.BackendConnectionException;
import io.github.flameyossnowy.geofilter.api.exceptions.FilterCancelledException;
import io.github.flameyossnowy.geofilter.api.exceptions.FilterException;
import io.github.flameyossnowy.geofilter.api.exceptions.FilterExecutionException;
import io.github.flameyossnowy.geofilter.api.exceptions.InvalidBufferExpressionException;
import io.github.flameyossnowy.geofilter.api.exceptions.UnsupportedFeatureException;
import io.github.flameyossnowy.geofilter.api.expression.BuildOptions;
import io.github.flameyossnowy.geofilter.api.expression.BuiltExpression;
import io.github.flameyossnowy.geofilter.api.history.HistoryEntry;
import io.github.flameyossnowy.geofilter.api.history.SubsetHistoryLog;
import io.github.flameyossnowy.geofilter.api.layer.Dialect;
import io.github.flameyossnowy.geofilter.api.layer.LayerCatalog;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.result.FilterResult;
import io.github.flameyossnowy.geofilter.api.session.CancellationToken;
import io.github.flameyossnowy.geofilter.api.session.FilterSession;
import io.github.flameyossnowy.geofilter.api.source.PreparedSource;
import io.github.flameyossnowy.geofilter.api.source.SourceGeometryRef;
import io.github.flameyossnowy.geofilter.api.source.SourceGeometryResolver;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Runs a filter request over all of its target layers.
 * <p>
 * Each layer is built and executed on its own: a layer that fails is reported and the batch
 * moves on. A layer whose dialect cannot express the request is rebuilt with the fallback
 * backend. Cancellation stops the batch before the next layer.
 */
public final class FilterEngine {
    private final BackendSelector selector;
    private final LayerCatalog catalog;
    private final FilterEngineConfig config;
    private final SourceGeometryResolver sourceResolver;
    private final SubsetCombiner subsetCombiner;
    private final SubsetHistoryLog history;

    public FilterEngine(@NotNull BackendSelector selector, @NotNull LayerCatalog catalog, @NotNull FilterEngineConfig config, @Nullable SubsetHistoryLog history) {
        this.selector = Objects.requireNonNull(selector, "Selector cannot be null");
        this.catalog = Objects.requireNonNull(catalog, "Catalog cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.sourceResolver = new SourceGeometryResolver(config.simpleWktMaxFeatures(), config.maxWktLength());
        this.subsetCombiner = new SubsetCombiner(config.materializedViewPrefix());
        this.history = history;
    }

    public FilterEngine(@NotNull BackendSelector selector, @NotNull LayerCatalog catalog, @NotNull FilterEngineConfig config) {
        this(selector, catalog, config, null);
    }

    /**
     * Runs on a background executor. The coordinating thread never blocks on a store.
     */
    public CompletableFuture<FilterOutcome> submit(@NotNull FilterSession session, @NotNull FilterRequest request, @NotNull CancellationToken cancellation, @NotNull Executor executor) {
        return CompletableFuture.supplyAsync(() -> run(session, request, cancellation), executor);
    }

    /**
     * @throws InvalidBufferExpressionException if the request's per-feature buffer expression is malformed
     */
    @NotNull
    public FilterOutcome run(@NotNull FilterSession session, @NotNull FilterRequest request, @NotNull CancellationToken cancellation) {
        BufferConfig buffer = withConfiguredSegments(request.buffer());
        if (buffer.dynamic()) {
            buffer.parsedExpression();
        }

        PreparedSource prepared = request.predicates().isEmpty() || request.source() == null
            ? null
            : sourceResolver.prepare(session, request.sourceLayerId(), request.source());

        BuildOptions options = new BuildOptions(
            request.useCentroids(),
            config.centroidMode(),
            request.attributeFilter(),
            config.metricSrid(),
            config.simplifyWktThreshold()
        );

        List<FilterResult> results = new ArrayList<>(request.targetLayerIds().size());
        boolean cancelled = false;

        for (String layerId : request.targetLayerIds()) {
            if (cancelled || cancellation.isCancelled()) {
                cancelled = true;
                results.add(FilterResult.failure(layerId, "none", "Cancelled", 0));
                continue;
            }

            FilterResult result = runLayer(session, request, prepared, buffer, options, layerId, cancellation);
            if (!result.success() && cancellation.isCancelled()) {
                cancelled = true;
            }
            results.add(result);
        }

        FilterOutcome outcome = new FilterOutcome(results, cancelled);
        Logging.info(() -> "Filter batch from " + request.sourceLayerId() + " finished: " + outcome.status()
            + " (" + outcome.succeeded().size() + "/" + results.size() + " layers)");
        return outcome;
    }

    /**
     * Appends every successful result of an outcome the host has applied.
     */
    public List<HistoryEntry> recordApplied(@NotNull String projectId, @NotNull String sourceLayerId, @NotNull FilterOutcome outcome) {
        if (history == null) {
            return List.of();
        }

        List<HistoryEntry> entries = new ArrayList<>();
        for (FilterResult result : outcome.succeeded()) {
            entries.add(history.append(projectId, result.layerId(), sourceLayerId, result.filterText()));
        }
        return entries;
    }

    /**
     * Forgets a layer removed from the project: its history rows and cached geometry.
     *
     * @return number of deleted history rows
     */
    public int removeLayer(@NotNull FilterSession session, @NotNull String projectId, @NotNull String layerId) {
        int evicted = session.geometryCache().invalidateLayer(layerId);
        int deleted = history == null ? 0 : history.deleteLayer(projectId, layerId);
        Logging.info(() -> "Removed layer " + layerId + ": " + deleted + " history rows, " + evicted + " cached geometries");
        return deleted;
    }

    private FilterResult runLayer(
        FilterSession session,
        FilterRequest request,
        @Nullable PreparedSource prepared,
        BufferConfig buffer,
        BuildOptions options,
        String layerId,
        CancellationToken cancellation
    ) {
        long start = System.nanoTime();

        Optional<LayerInfo> described = catalog.describe(layerId);
        if (described.isEmpty()) {
            Logging.warn("Skipping unknown layer " + layerId);
            return FilterResult.failure(layerId, "none", "Unknown layer " + layerId, 0);
        }

        LayerInfo target = described.get();
        FilterBackend backend = selector.select(target, request.backendOverrides().get(layerId));

        try {
            SourceGeometryRef source = resolveSource(request, prepared, backend, target);
            BuiltExpression built;
            try {
                built = backend.builder().build(source, request.predicates(), request.operator(), buffer, target, options);
            } catch (UnsupportedFeatureException e) {
                FilterBackend fallback = selector.fallback();
                if (fallback == backend) {
                    throw e;
                }

                FilterBackend primary = backend;
                primary.metrics().recordError();
                Logging.info(() -> primary.name() + " cannot express the filter for layer " + layerId + " (" + e.getMessage()
                    + "), rebuilding with " + fallback.name());
                backend = fallback;
                source = prepared == null ? null : sourceResolver.literal(prepared);
                built = backend.builder().build(source, request.predicates(), request.operator(), buffer, target, options);
            }

            for (String diagnostic : built.diagnostics()) {
                Logging.deepInfo(() -> "[" + layerId + "] " + diagnostic);
            }

            cancellation.throwIfCancelled("filtering layer " + layerId);
            FilterResult result = backend.executor().execute(new ExecutionRequest(session, target, built, cancellation));
            return combineWithExisting(request, result);
        } catch (InvalidBufferExpressionException e) {
            backend.metrics().recordError();
            throw e;
        } catch (FilterCancelledException e) {
            Logging.info(() -> "Filtering of layer " + layerId + " cancelled");
            return FilterResult.failure(layerId, backend.name(), "Cancelled", elapsedMillis(start));
        } catch (BackendConnectionException e) {
            backend.metrics().recordError();
            Logging.error("[" + backend.name() + "] connection lost while filtering layer " + layerId + ": " + e.getMessage());
            return FilterResult.failure(layerId, backend.name(), e.getMessage(), elapsedMillis(start));
        } catch (FilterExecutionException e) {
            backend.metrics().recordError();
            Logging.error("[" + backend.name() + "] " + e.getOperation() + " failed for layer " + layerId + ": " + e.getNativeMessage());
            return FilterResult.failure(layerId, backend.name(), e.getNativeMessage(), elapsedMillis(start));
        } catch (FilterException | IllegalArgumentException e) {
            backend.metrics().recordError();
            Logging.error("[" + backend.name() + "] failed to filter layer " + layerId + ": " + e.getMessage());
            return FilterResult.failure(layerId, backend.name(), e.getMessage(), elapsedMillis(start));
        } catch (RuntimeException e) {
            backend.metrics().recordError();
            Logging.error("[" + backend.name() + "] unexpected failure on layer " + layerId, e);
            return FilterResult.failure(layerId, backend.name(), e.getClass().getSimpleName() + ": " + e.getMessage(), elapsedMillis(start));
        }
    }

    /**
     * A buffer still carrying the built-in segment count takes the configured one.
     */
    private BufferConfig withConfiguredSegments(BufferConfig buffer) {
        if (buffer.segments() != BufferConfig.DEFAULT_SEGMENTS || buffer.segments() == config.defaultSegments()) {
            return buffer;
        }
        return buffer.withSegments(config.defaultSegments());
    }

    /**
     * The generic dialect evaluates in-process and always needs the geometry inline.
     */
    @Nullable
    private SourceGeometryRef resolveSource(FilterRequest request, @Nullable PreparedSource prepared, FilterBackend backend, LayerInfo target) {
        if (prepared == null) {
            return null;
        }
        if (backend.builder().dialect() == Dialect.GENERIC) {
            return sourceResolver.literal(prepared);
        }
        return sourceResolver.resolve(request.source(), prepared, target);
    }

    private FilterResult combineWithExisting(FilterRequest request, FilterResult result) {
        if (!result.success() || request.subsetCombineOperator() == null) {
            return result;
        }

        String existing = request.existingSubsets().get(result.layerId());
        String combined = subsetCombiner.combine(existing, Objects.requireNonNull(result.filterText()), request.subsetCombineOperator());
        if (combined.equals(result.filterText())) {
            return result;
        }

        return new FilterResult(
            result.layerId(),
            result.backendName(),
            true,
            result.matchedIds(),
            combined,
            result.executionTimeMillis(),
            result.usedOptimization(),
            null
        );
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
