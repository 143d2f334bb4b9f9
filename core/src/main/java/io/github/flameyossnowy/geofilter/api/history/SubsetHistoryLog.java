package io.github.flameyossnowy.geofilter.api.history;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Append-only log of subset definitions applied to layers, used for undo.
 */
public interface SubsetHistoryLog {
    /**
     * Appends a change with the next sequence number for (project, layer).
     */
    @NotNull
    HistoryEntry append(@NotNull String projectId, @NotNull String layerId, @Nullable String sourceLayerId, @NotNull String subset);

    Optional<HistoryEntry> latest(@NotNull String projectId, @NotNull String layerId);

    /**
     * Entries of one layer, newest first.
     */
    List<HistoryEntry> entries(@NotNull String projectId, @NotNull String layerId);

    /**
     * Deletes every entry of a removed layer.
     *
     * @return number of deleted entries
     */
    int deleteLayer(@NotNull String projectId, @NotNull String layerId);
}
