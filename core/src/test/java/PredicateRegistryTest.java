import io.github.flameyossnowy.geofilter.api.layer.Dialect;
import io.github.flameyossnowy.geofilter.api.predicate.PredicateRegistry;
import io.github.flameyossnowy.geofilter.api.predicate.PredicateSet;
import io.github.flameyossnowy.geofilter.api.predicate.SpatialPredicate;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PredicateRegistryTest {

    @Test
    void names_are_normalized_regardless_of_prefix_and_case() {
        assertEquals("coveredby", PredicateRegistry.canonicalName("ST_Covered_By"));
        assertEquals("intersects", PredicateRegistry.canonicalName("  Intersects "));
        assertEquals(Optional.of(SpatialPredicate.CONTAINS_PROPERLY), PredicateRegistry.lookup("st_containsproperly"));
    }

    @Test
    void selectivity_order_puts_within_first_and_intersects_last() {
        List<String> sorted = PredicateRegistry.sortBySelectivity(List.of("intersects", "touches", "ST_Within", "disjoint"));
        assertEquals(List.of("within", "disjoint", "touches", "intersects"), sorted);
    }

    @Test
    void unknown_predicates_sort_last_without_failing() {
        List<String> sorted = PredicateRegistry.sortBySelectivity(List.of("nearby", "intersects", "within"));
        assertEquals(List.of("within", "intersects", "nearby"), sorted);
        assertEquals(PredicateRegistry.UNKNOWN_ORDER, PredicateRegistry.selectivityOrder("nearby"));
    }

    @Test
    void ordering_is_total_and_independent_of_input_order() {
        List<String> names = new ArrayList<>();
        for (SpatialPredicate predicate : SpatialPredicate.values()) {
            names.add(predicate.canonicalName());
        }
        List<String> expected = PredicateRegistry.sortBySelectivity(names);

        Random random = new Random(42);
        for (int i = 0; i < 50; i++) {
            Collections.shuffle(names, random);
            assertEquals(expected, PredicateRegistry.sortBySelectivity(names));
        }
    }

    @Test
    void contains_and_contains_properly_tie_is_broken_by_name() {
        List<String> sorted = PredicateRegistry.sortBySelectivity(List.of("containsproperly", "contains"));
        assertEquals(List.of("contains", "containsproperly"), sorted);
    }

    @Test
    void dialect_symbols_follow_each_dialect() {
        assertEquals(Optional.of("ST_Intersects"), PredicateRegistry.dialectSymbol("intersects", Dialect.POSTGIS));
        assertEquals(Optional.of("Intersects"), PredicateRegistry.dialectSymbol("intersects", Dialect.SPATIALITE));
        assertEquals(Optional.of("coveredBy"), PredicateRegistry.dialectSymbol("covered_by", Dialect.GENERIC));
    }

    @Test
    void predicate_without_a_dialect_symbol_is_absent() {
        assertTrue(PredicateRegistry.dialectSymbol("containsproperly", Dialect.SPATIALITE).isEmpty());
        assertTrue(PredicateRegistry.dialectSymbol("nearby", Dialect.POSTGIS).isEmpty());
    }

    @Test
    void predicate_set_sorts_and_removes_duplicates() {
        PredicateSet set = PredicateSet.of("Intersects", "ST_Intersects", "within");
        assertEquals(List.of("within", "intersects"), set.names());
        assertEquals(2, set.size());
        assertTrue(PredicateSet.empty().isEmpty());
    }
}
