package io.github.flameyossnowy.geofilter.api.session;

/**
 * Something a {@link FilterSession} owns and tears down when it closes:
 * connection pools, materialized result sets.
 */
public interface SessionResource extends AutoCloseable {
    @Override
    void close();
}
