package io.github.flameyossnowy.geofilter.postgresql.materialized;

import io.github.flameyossnowy.geofilter.sql.query.SqlIdentifiers;

/**
 * Lookup key of a materialized result set. Holds no connection or state of its own.
 *
 * @param storeKey  store the view lives in
 * @param schema    schema of the view
 * @param name      view name, unique per session and query
 * @param baseTable qualified table the view was derived from
 */
public record MaterializedResultSet(String storeKey, String schema, String name, String baseTable) {
    public String qualifiedName() {
        return SqlIdentifiers.qualified(schema, name);
    }
}
