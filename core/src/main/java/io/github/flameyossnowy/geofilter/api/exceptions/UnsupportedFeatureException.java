package io.github.flameyossnowy.geofilter.api.exceptions;

import io.github.flameyossnowy.geofilter.api.layer.Dialect;

/**
 * A dialect cannot express part of a request natively. Never retried: the engine
 * rebuilds the filter with the generic-format builder instead.
 */
public class UnsupportedFeatureException extends FilterException {
    private final Dialect dialect;

    public UnsupportedFeatureException(Dialect dialect, String message) {
        super(message);
        this.dialect = dialect;
    }

    public Dialect getDialect() {
        return dialect;
    }
}
