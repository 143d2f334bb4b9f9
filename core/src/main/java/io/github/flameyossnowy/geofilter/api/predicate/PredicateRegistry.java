package io.github.flameyossnowy.geofilter.api.predicate;

import io.github.flameyossnowy.geofilter.api.layer.Dialect;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical predicate names, their per-dialect symbols and their evaluation order.
 */
public final class PredicateRegistry {
    public static final int UNKNOWN_ORDER = 99;

    private static final Map<String, SpatialPredicate> BY_NAME = new HashMap<>();

    private static final Comparator<String> SELECTIVITY = Comparator
        .comparingInt(PredicateRegistry::selectivityOrder)
        .thenComparing(PredicateRegistry::canonicalName);

    static {
        for (SpatialPredicate predicate : SpatialPredicate.values()) {
            BY_NAME.put(predicate.canonicalName(), predicate);
        }
    }

    private PredicateRegistry() {}

    /**
     * Normalizes a caller-supplied name: case-insensitive, an optional {@code ST_} prefix,
     * underscores and blanks ignored. {@code "ST_Covered_By"} becomes {@code "coveredby"}.
     */
    @NotNull
    public static String canonicalName(@NotNull String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("st_")) {
            normalized = normalized.substring(3);
        }
        return normalized.replace("_", "").replace(" ", "");
    }

    public static Optional<SpatialPredicate> lookup(@NotNull String name) {
        return Optional.ofNullable(BY_NAME.get(canonicalName(name)));
    }

    public static Optional<String> dialectSymbol(@NotNull String name, @NotNull Dialect dialect) {
        return lookup(name).map(predicate -> predicate.symbol(dialect));
    }

    public static int selectivityOrder(@NotNull String name) {
        return lookup(name).map(SpatialPredicate::selectivity).orElse(UNKNOWN_ORDER);
    }

    /**
     * Returns the canonical names ordered by selectivity, ties broken by name.
     * Unknown names sort last instead of failing.
     */
    @NotNull
    public static List<String> sortBySelectivity(@NotNull Collection<String> names) {
        List<String> sorted = new ArrayList<>(names.size());
        for (String name : names) {
            sorted.add(canonicalName(name));
        }
        sorted.sort(SELECTIVITY);
        return sorted;
    }
}
