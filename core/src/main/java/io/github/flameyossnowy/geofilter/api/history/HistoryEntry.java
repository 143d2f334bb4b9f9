package io.github.flameyossnowy.geofilter.api.history;

import java.time.Instant;

/**
 * One applied subset change.
 */
public record HistoryEntry(
    String id,
    String projectId,
    String layerId,
    String sourceLayerId,
    int sequence,
    String subset,
    Instant updatedAt
) {}
