package io.github.flameyossnowy.geofilter.api.exceptions;

/**
 * Root of every failure raised while building or executing a spatial filter.
 */
public class FilterException extends RuntimeException {
    public FilterException(String message) {
        super(message);
    }

    public FilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
