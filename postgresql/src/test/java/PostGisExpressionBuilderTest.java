import io.github.flameyossnowy.geofilter.api.buffer.BufferConfig;
import io.github.flameyossnowy.geofilter.api.buffer.EndCapStyle;
import io.github.flameyossnowy.geofilter.api.buffer.JoinStyle;
import io.github.flameyossnowy.geofilter.api.exceptions.UnsupportedFeatureException;
import io.github.flameyossnowy.geofilter.api.exceptions.UnsupportedPredicateException;
import io.github.flameyossnowy.geofilter.api.expression.AttributeCondition;
import io.github.flameyossnowy.geofilter.api.expression.AttributeFilter;
import io.github.flameyossnowy.geofilter.api.expression.BuildOptions;
import io.github.flameyossnowy.geofilter.api.expression.BuiltExpression;
import io.github.flameyossnowy.geofilter.api.expression.CentroidMode;
import io.github.flameyossnowy.geofilter.api.expression.ComparisonOperator;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.layer.PrimaryKeyDescriptor;
import io.github.flameyossnowy.geofilter.api.layer.StorageKind;
import io.github.flameyossnowy.geofilter.api.predicate.CombineOperator;
import io.github.flameyossnowy.geofilter.api.predicate.PredicateSet;
import io.github.flameyossnowy.geofilter.api.source.SourceFeature;
import io.github.flameyossnowy.geofilter.api.source.SourceGeometryRef;
import io.github.flameyossnowy.geofilter.postgresql.query.PostGisExpressionBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class PostGisExpressionBuilderTest {
    private static final String SQUARE = "POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))";

    private final PostGisExpressionBuilder builder = new PostGisExpressionBuilder();

    private static LayerInfo roads(String crs) {
        return new LayerInfo("roads", "roads", StorageKind.RELATIONAL_STORE, 500, "public", "roads", "geom", crs,
            PrimaryKeyDescriptor.numeric("id"), "postgresql://localhost:5432/gis");
    }

    private static SourceGeometryRef.Literal literal(String wkt, int srid) {
        return new SourceGeometryRef.Literal(wkt, srid, List.of(SourceFeature.of(wkt)), false);
    }

    private BuiltExpression build(SourceGeometryRef source, BufferConfig buffer, LayerInfo target, String... predicates) {
        return builder.build(source, PredicateSet.of(predicates), CombineOperator.OR, buffer, target, BuildOptions.defaults());
    }

    @Test
    void plain_literal_is_made_valid_and_tested() {
        BuiltExpression built = build(literal(SQUARE, 3857), BufferConfig.none(), roads("EPSG:3857"), "intersects");

        assertEquals("ST_Intersects(\"roads\".\"geom\", ST_MakeValid(ST_GeomFromText('" + SQUARE + "', 3857)))", built.raw());
        assertTrue(built.expression().spatial());
    }

    @Test
    void geographic_source_is_projected_before_buffering() {
        BuiltExpression built = build(literal("POINT (1 2)", 4326), BufferConfig.distance(100), roads("EPSG:3857"), "intersects");

        assertEquals("ST_Intersects(\"roads\".\"geom\", ST_Buffer(ST_Transform(ST_MakeValid(ST_GeomFromText('POINT (1 2)', 4326)), 3857), 100, 'quad_segs=5'))",
            built.raw());
    }

    @Test
    void buffered_source_is_projected_to_the_target_afterwards() {
        String raw = build(literal("POINT (1 2)", 4326), BufferConfig.distance(100), roads("EPSG:2154"), "intersects").raw();

        assertTrue(raw.startsWith("ST_Intersects(\"roads\".\"geom\", ST_Transform(ST_Buffer(ST_Transform("), raw);
        assertTrue(raw.endsWith(", 100, 'quad_segs=5'), 2154))"), raw);
    }

    @Test
    void buffer_distance_keeps_its_precision() {
        String raw = build(literal(SQUARE, 3857), BufferConfig.distance(12.345678), roads("EPSG:3857"), "intersects").raw();

        Matcher matcher = Pattern.compile("ST_Buffer\\(.*, (-?[0-9.]+), 'quad_segs").matcher(raw);
        assertTrue(matcher.find(), raw);
        assertEquals(12.345678, Double.parseDouble(matcher.group(1)));
    }

    @Test
    void tiny_distances_are_not_written_in_exponent_form() {
        String raw = build(literal(SQUARE, 3857), BufferConfig.distance(0.0001), roads("EPSG:3857"), "intersects").raw();

        assertTrue(raw.contains(", 0.0001, 'quad_segs=5'"), raw);
        assertFalse(raw.contains("E-"));
    }

    @Test
    void non_round_styles_are_spelled_out() {
        BufferConfig buffer = BufferConfig.distance(5).withSegments(8).withEndCapStyle(EndCapStyle.FLAT).withJoinStyle(JoinStyle.MITRE);
        String raw = build(literal(SQUARE, 3857), buffer, roads("EPSG:3857"), "intersects").raw();

        assertTrue(raw.contains("'quad_segs=8 endcap=flat join=mitre'"), raw);
    }

    @Test
    void negative_buffer_is_guarded_against_empty_geometries() {
        String raw = build(literal(SQUARE, 3857), BufferConfig.distance(-5), roads("EPSG:3857"), "intersects").raw();

        String buffered = "ST_Buffer(ST_MakeValid(ST_GeomFromText('" + SQUARE + "', 3857)), -5, 'quad_segs=5')";
        assertEquals("ST_Intersects(\"roads\".\"geom\", CASE WHEN ST_IsEmpty(ST_MakeValid(" + buffered + ")) THEN NULL ELSE ST_MakeValid(" + buffered + ") END)",
            raw);
    }

    @Test
    void table_source_is_correlated_with_exists() {
        SourceGeometryRef.TableReference towns = new SourceGeometryRef.TableReference("public", "towns", "geom", "\"pop\" > 10", 3857, false);

        BuiltExpression built = build(towns, BufferConfig.none(), roads("EPSG:3857"), "intersects");

        assertEquals("EXISTS (SELECT 1 FROM \"public\".\"towns\" AS __source WHERE ST_Intersects(\"roads\".\"geom\", \"__source\".\"geom\") AND (\"pop\" > 10))",
            built.raw());
    }

    @Test
    void per_feature_buffer_reads_the_correlated_row() {
        SourceGeometryRef.TableReference rivers = new SourceGeometryRef.TableReference("public", "rivers", "geom", null, 3857, false);
        BufferConfig buffer = new BufferConfig(0.0, "width * 2", true, 5, EndCapStyle.ROUND, JoinStyle.ROUND);

        BuiltExpression built = build(rivers, buffer, roads("EPSG:3857"), "intersects");

        assertEquals("EXISTS (SELECT 1 FROM \"public\".\"rivers\" AS __source WHERE ST_Intersects(\"roads\".\"geom\", ST_Buffer(\"__source\".\"geom\", (CAST(\"__source\".\"width\" AS double precision) * 2.0), 'quad_segs=5')))",
            built.raw());
        assertTrue(built.expression().referencedFields().contains("width"));
    }

    @Test
    void per_feature_division_is_done_in_double_precision() {
        SourceGeometryRef.TableReference rivers = new SourceGeometryRef.TableReference("public", "rivers", "geom", null, 3857, false);
        BufferConfig buffer = new BufferConfig(0.0, "width / 2 + lanes / 4", true, 5, EndCapStyle.ROUND, JoinStyle.ROUND);

        String raw = build(rivers, buffer, roads("EPSG:3857"), "intersects").raw();

        assertTrue(raw.contains("((CAST(\"__source\".\"width\" AS double precision) / 2.0) + (CAST(\"__source\".\"lanes\" AS double precision) / 4.0))"), raw);
    }

    @Test
    void per_feature_buffer_on_a_literal_needs_the_fallback() {
        BufferConfig buffer = new BufferConfig(0.0, "width * 2", true, 5, EndCapStyle.ROUND, JoinStyle.ROUND);

        assertThrows(UnsupportedFeatureException.class, () -> build(literal(SQUARE, 3857), buffer, roads("EPSG:3857"), "intersects"));
    }

    @Test
    void mixed_collection_cannot_be_buffered() {
        String wkt = "GEOMETRYCOLLECTION (POINT (1 1), LINESTRING (0 0, 5 5))";
        SourceGeometryRef.Literal mixed = new SourceGeometryRef.Literal(wkt, 3857, List.of(SourceFeature.of(wkt)), true);

        assertThrows(UnsupportedFeatureException.class, () -> build(mixed, BufferConfig.distance(10), roads("EPSG:3857"), "intersects"));
        assertDoesNotThrow(() -> build(mixed, BufferConfig.none(), roads("EPSG:3857"), "intersects"));
    }

    @Test
    void identifiers_keep_their_case_and_spaces() {
        LayerInfo target = new LayerInfo("main", "Main Roads", StorageKind.RELATIONAL_STORE, 10, "GIS", "Main Roads", "Geom",
            "EPSG:3857", PrimaryKeyDescriptor.numeric("ID"), "postgresql://localhost:5432/gis");

        String raw = build(literal(SQUARE, 3857), BufferConfig.none(), target, "intersects").raw();

        assertTrue(raw.startsWith("ST_Intersects(\"Main Roads\".\"Geom\", "), raw);
    }

    @Test
    void predicates_are_ordered_by_selectivity() {
        String raw = build(literal(SQUARE, 3857), BufferConfig.none(), roads("EPSG:3857"), "intersects", "within").raw();

        String source = "ST_MakeValid(ST_GeomFromText('" + SQUARE + "', 3857))";
        assertEquals("(ST_Within(\"roads\".\"geom\", " + source + ") OR ST_Intersects(\"roads\".\"geom\", " + source + "))", raw);
    }

    @Test
    void centroids_replace_the_target_geometry() {
        BuildOptions options = BuildOptions.defaults().withCentroids(true);

        String raw = builder.build(literal(SQUARE, 3857), PredicateSet.of("within"), CombineOperator.AND, BufferConfig.none(), roads("EPSG:3857"), options).raw();

        assertTrue(raw.startsWith("ST_Within(ST_PointOnSurface(\"roads\".\"geom\"), "), raw);
        assertEquals(CentroidMode.POINT_ON_SURFACE, options.centroidMode());
    }

    @Test
    void attribute_conditions_are_anded_last() {
        BuildOptions options = BuildOptions.defaults().withAttributeFilter(AttributeFilter.of(
            new AttributeCondition("kind", ComparisonOperator.EQUALS, "road"),
            new AttributeCondition("lanes", ComparisonOperator.GREATER_THAN, 1)
        ));

        BuiltExpression built = builder.build(literal(SQUARE, 3857), PredicateSet.of("intersects"), CombineOperator.AND, BufferConfig.none(), roads("EPSG:3857"), options);

        assertTrue(built.raw().endsWith(" AND ((\"kind\" = 'road') AND (\"lanes\" > 1))"), built.raw());
        assertTrue(built.expression().referencedFields().containsAll(List.of("geom", "kind", "lanes")));
    }

    @Test
    void attribute_only_filter_is_not_spatial() {
        BuildOptions options = BuildOptions.defaults().withAttributeFilter(AttributeFilter.of(new AttributeCondition("kind", ComparisonOperator.EQUALS, "road")));

        BuiltExpression built = builder.build(null, PredicateSet.empty(), CombineOperator.AND, BufferConfig.none(), roads("EPSG:3857"), options);

        assertEquals("\"kind\" = 'road'", built.raw());
        assertFalse(built.expression().spatial());
    }

    @Test
    void unknown_predicate_is_rejected() {
        assertThrows(UnsupportedPredicateException.class, () -> build(literal(SQUARE, 3857), BufferConfig.none(), roads("EPSG:3857"), "nearby"));
    }
}
