package io.github.flameyossnowy.geofilter.api.exceptions;

public class FilterCancelledException extends FilterException {
    public FilterCancelledException(String message) {
        super(message);
    }
}
