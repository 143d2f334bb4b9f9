package io.github.flameyossnowy.geofilter.api.source;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * How a built filter reaches its source geometry. Built once per target by
 * {@link SourceGeometryResolver} and consumed by the expression builders as-is.
 */
public sealed interface SourceGeometryRef permits SourceGeometryRef.Literal, SourceGeometryRef.TableReference {
    int srid();

    /**
     * The geometry travels inside the filter text.
     *
     * @param mixedCollection whether {@code wkt} is a heterogeneous geometry collection
     */
    record Literal(
        @NotNull String wkt,
        int srid,
        @NotNull List<SourceFeature> features,
        boolean mixedCollection
    ) implements SourceGeometryRef {
        public Literal {
            Objects.requireNonNull(wkt, "Source WKT cannot be null");
            features = List.copyOf(features);
        }
    }

    /**
     * The source is a table in the same store as the target, reached through a correlated subquery.
     */
    record TableReference(
        @Nullable String schema,
        @NotNull String table,
        @NotNull String geometryColumn,
        @Nullable String sourceFilter,
        int srid,
        boolean geoPackage
    ) implements SourceGeometryRef {
        public TableReference {
            Objects.requireNonNull(table, "Source table cannot be null");
            Objects.requireNonNull(geometryColumn, "Source geometry column cannot be null");
        }
    }
}
