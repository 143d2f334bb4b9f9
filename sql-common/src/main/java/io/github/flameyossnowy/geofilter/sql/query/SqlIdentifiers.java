package io.github.flameyossnowy.geofilter.sql.query;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Identifier quoting. Names are quoted exactly as cataloged: case is preserved and embedded
 * quotes are doubled, never stripped.
 */
public final class SqlIdentifiers {
    private SqlIdentifiers() {}

    public static String quote(@NotNull String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    public static String qualified(@Nullable String schema, @NotNull String table) {
        if (schema == null || schema.isEmpty()) {
            return quote(table);
        }
        return quote(schema) + "." + quote(table);
    }

    public static String column(@NotNull String tableOrAlias, @NotNull String column) {
        return quote(tableOrAlias) + "." + quote(column);
    }
}
