import io.github.flameyossnowy.geofilter.api.engine.SubsetCombiner;
import io.github.flameyossnowy.geofilter.api.predicate.CombineOperator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubsetCombinerTest {
    final SubsetCombiner combiner = new SubsetCombiner("fm_temp_mv_");

    @Test
    void attribute_subset_is_combined_with_the_new_filter() {
        assertEquals("(population > 1000) AND (\"id\" IN (1, 2))",
            combiner.combine(" population > 1000 ", "\"id\" IN (1, 2)", CombineOperator.AND));
        assertEquals("(a = 1) OR (b = 2)", combiner.combine("a = 1", "b = 2", CombineOperator.OR));
    }

    @Test
    void geometric_subsets_are_replaced() {
        assertEquals("b = 2", combiner.combine("ST_Intersects(\"t\".\"geom\", ST_GeomFromText('POINT (0 0)', 3857))", "b = 2", CombineOperator.AND));
        assertEquals("b = 2", combiner.combine("Intersects(GeomFromGPB(\"t\".\"geom\"), x) = 1", "b = 2", CombineOperator.AND));
        assertEquals("b = 2", combiner.combine("\"id\" IN (SELECT \"id\" FROM \"filtermate_temp\".\"fm_temp_mv_s1_abc\")", "b = 2", CombineOperator.OR));
    }

    @Test
    void no_operator_or_no_existing_subset_keeps_the_filter() {
        assertEquals("b = 2", combiner.combine("a = 1", "b = 2", null));
        assertEquals("b = 2", combiner.combine("  ", "b = 2", CombineOperator.AND));
        assertEquals("b = 2", combiner.combine(null, "b = 2", CombineOperator.AND));
    }

    @Test
    void column_names_resembling_predicates_are_not_geometric() {
        assertFalse(combiner.isGeometric("\"within_city\" = 1"));
        assertTrue(combiner.isGeometric("st_within(a, b)"));
    }

    @Test
    void quoted_identifiers_with_an_st_prefix_are_combined() {
        assertFalse(combiner.isGeometric("\"ST_code\" = 1"));
        assertFalse(combiner.isGeometric("\"ST_Within_count\" > 0"));
        assertFalse(combiner.isGeometric("my_within(\"zone\") = 1"));
        assertEquals("(\"ST_code\" = 1) AND (b = 2)", combiner.combine("\"ST_code\" = 1", "b = 2", CombineOperator.AND));
    }

    @Test
    void function_names_inside_string_literals_are_ignored() {
        assertFalse(combiner.isGeometric("\"note\" = 'ST_Intersects(a, b)'"));
        assertFalse(combiner.isGeometric("\"note\" = 'it''s within(x)'"));
        assertTrue(combiner.isGeometric("ST_Intersects(\"geom\", ST_GeomFromText('POINT (0 0)', 3857))"));
    }
}
