package io.github.flameyossnowy.geofilter.api.layer;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Locale;

/**
 * The kind of store a layer lives in. Every dispatch on a storage kind goes through an
 * exhaustive {@code switch}, so adding a kind fails to compile until every site handles it.
 */
public enum StorageKind {
    RELATIONAL_STORE,
    EMBEDDED_STORE,
    GENERIC_FORMAT;

    public Dialect dialect() {
        return switch (this) {
            case RELATIONAL_STORE -> Dialect.POSTGIS;
            case EMBEDDED_STORE -> Dialect.SPATIALITE;
            case GENERIC_FORMAT -> Dialect.GENERIC;
        };
    }

    /**
     * Maps a data-provider name to its storage kind. Anything unrecognized is a generic format.
     */
    @NotNull
    public static StorageKind fromProvider(@Nullable String providerName) {
        if (providerName == null) {
            return GENERIC_FORMAT;
        }

        return switch (providerName.trim().toLowerCase(Locale.ROOT)) {
            case "postgres", "postgresql", "postgis" -> RELATIONAL_STORE;
            case "spatialite", "sqlite", "gpkg", "geopackage" -> EMBEDDED_STORE;
            default -> GENERIC_FORMAT;
        };
    }
}
