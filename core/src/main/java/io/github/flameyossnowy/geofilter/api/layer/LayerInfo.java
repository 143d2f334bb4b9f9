package io.github.flameyossnowy.geofilter.api.layer;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;

/**
 * Read-only snapshot of a layer's metadata, taken when a filter is built.
 *
 * @param id             layer identifier used by the host
 * @param name           display name
 * @param storageKind    store the layer lives in
 * @param featureCount   feature count at snapshot time, {@code -1} when unknown
 * @param schema         schema name, {@code null} for stores without schemas
 * @param table          table (or file layer) name, exactly as cataloged
 * @param geometryColumn geometry column, exactly as cataloged
 * @param crsCode        authority code such as {@code EPSG:4326}
 * @param primaryKey     primary key used to report matched features
 * @param source         store locator: a JDBC URL, a database file or a feature file
 */
public record LayerInfo(
    @NotNull String id,
    @NotNull String name,
    @NotNull StorageKind storageKind,
    long featureCount,
    @Nullable String schema,
    @NotNull String table,
    @NotNull String geometryColumn,
    @NotNull String crsCode,
    @NotNull PrimaryKeyDescriptor primaryKey,
    @Nullable String source
) {
    public LayerInfo {
        Objects.requireNonNull(id, "Layer id cannot be null");
        Objects.requireNonNull(name, "Layer name cannot be null");
        Objects.requireNonNull(storageKind, "Storage kind cannot be null");
        Objects.requireNonNull(table, "Table cannot be null");
        Objects.requireNonNull(geometryColumn, "Geometry column cannot be null");
        Objects.requireNonNull(crsCode, "CRS code cannot be null");
        Objects.requireNonNull(primaryKey, "Primary key cannot be null");
    }

    public int srid() {
        return CrsSupport.srid(crsCode);
    }

    public boolean isGeoPackage() {
        return source != null && source.toLowerCase(Locale.ROOT).endsWith(".gpkg");
    }

    /**
     * Two layers share a store when a correlated subquery on one can see the other's table.
     * Generic-format layers never share a store.
     */
    public boolean sharesStoreWith(@NotNull LayerInfo other) {
        if (storageKind != other.storageKind || storageKind == StorageKind.GENERIC_FORMAT) {
            return false;
        }
        return source != null && source.equals(other.source);
    }

    public LayerInfo withFeatureCount(long featureCount) {
        return new LayerInfo(id, name, storageKind, featureCount, schema, table, geometryColumn, crsCode, primaryKey, source);
    }
}
