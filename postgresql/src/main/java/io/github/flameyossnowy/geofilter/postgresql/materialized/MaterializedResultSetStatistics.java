package io.github.flameyossnowy.geofilter.postgresql.materialized;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * @param rowCount    planner row estimate, {@code -1} before the first ANALYZE
 * @param sizeBytes   on-disk size of the view's heap
 * @param lastRefresh creation or last refresh time, {@code null} if unknown to this session
 */
public record MaterializedResultSetStatistics(long rowCount, long sizeBytes, @Nullable Instant lastRefresh) {}
