package io.github.flameyossnowy.geofilter.api.exceptions;

import io.github.flameyossnowy.geofilter.api.layer.Dialect;

public class UnsupportedPredicateException extends UnsupportedFeatureException {
    private final String predicate;

    public UnsupportedPredicateException(Dialect dialect, String predicate) {
        super(dialect, "Predicate '" + predicate + "' is not supported by dialect " + dialect);
        this.predicate = predicate;
    }

    public String getPredicate() {
        return predicate;
    }
}
