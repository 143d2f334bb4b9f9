package io.github.flameyossnowy.geofilter.api.predicate;

import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Canonical predicate names in evaluation order. The order the caller supplied is discarded.
 */
public record PredicateSet(@NotNull List<String> names) implements Iterable<String> {
    private static final PredicateSet EMPTY = new PredicateSet(List.of());

    public PredicateSet {
        names = List.copyOf(new LinkedHashSet<>(PredicateRegistry.sortBySelectivity(names)));
    }

    public static PredicateSet of(String... names) {
        return new PredicateSet(List.of(names));
    }

    public static PredicateSet of(Collection<String> names) {
        return new PredicateSet(List.copyOf(names));
    }

    public static PredicateSet empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public int size() {
        return names.size();
    }

    @NotNull
    @Override
    public Iterator<String> iterator() {
        return names.iterator();
    }
}
