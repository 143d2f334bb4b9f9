import io.github.flameyossnowy.geofilter.api.backend.BackendSelector;
import io.github.flameyossnowy.geofilter.api.backend.ExecutionRequest;
import io.github.flameyossnowy.geofilter.api.buffer.BufferConfig;
import io.github.flameyossnowy.geofilter.api.engine.FilterEngine;
import io.github.flameyossnowy.geofilter.api.engine.FilterEngineConfig;
import io.github.flameyossnowy.geofilter.api.engine.FilterOutcome;
import io.github.flameyossnowy.geofilter.api.engine.FilterRequest;
import io.github.flameyossnowy.geofilter.api.exceptions.FilterCancelledException;
import io.github.flameyossnowy.geofilter.api.expression.AttributeCondition;
import io.github.flameyossnowy.geofilter.api.expression.AttributeFilter;
import io.github.flameyossnowy.geofilter.api.expression.BuildOptions;
import io.github.flameyossnowy.geofilter.api.expression.BuiltExpression;
import io.github.flameyossnowy.geofilter.api.expression.ComparisonOperator;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.layer.PrimaryKeyDescriptor;
import io.github.flameyossnowy.geofilter.api.layer.StorageKind;
import io.github.flameyossnowy.geofilter.api.predicate.CombineOperator;
import io.github.flameyossnowy.geofilter.api.predicate.PredicateSet;
import io.github.flameyossnowy.geofilter.api.result.FilterResult;
import io.github.flameyossnowy.geofilter.api.session.CancellationToken;
import io.github.flameyossnowy.geofilter.api.session.FilterSession;
import io.github.flameyossnowy.geofilter.generic.GenericBackendBuilder;
import io.github.flameyossnowy.geofilter.generic.features.Feature;
import io.github.flameyossnowy.geofilter.generic.features.InMemoryFeatureSource;
import io.github.flameyossnowy.geofilter.postgresql.query.PostGisExpressionBuilder;
import io.github.flameyossnowy.geofilter.sqlite.SQLiteBackend;
import io.github.flameyossnowy.geofilter.sqlite.SQLiteBackendBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SpatiaLiteFilterExecutorTest {
    @TempDir
    Path directory;

    SqliteFixture fixture;
    SQLiteBackend backend;
    FilterSession session;
    LayerInfo roads;
    final AtomicInteger providersOpened = new AtomicInteger();

    @BeforeEach
    void setup() throws SQLException {
        fixture = new SqliteFixture(directory.resolve("network.sqlite"));
        fixture.execute(
            "CREATE TABLE roads (id INTEGER PRIMARY KEY, kind TEXT, lanes INTEGER, name TEXT, geom BLOB)",
            "INSERT INTO roads VALUES (1, 'road', 2, 'Main', NULL)",
            "INSERT INTO roads VALUES (2, 'road', 1, NULL, NULL)",
            "INSERT INTO roads VALUES (3, 'path', NULL, 'Trail', NULL)",
            "INSERT INTO roads VALUES (4, 'river', 0, 'Seine', NULL)",
            "INSERT INTO roads VALUES (5, 'road', 4, 'Ring', NULL)"
        );

        backend = new SQLiteBackendBuilder()
            .loadSpatialite(false)
            .withConnectionProvider(path -> {
                providersOpened.incrementAndGet();
                return fixture;
            })
            .build();
        session = new FilterSession("sqlite");
        roads = new LayerInfo("roads", "roads", StorageKind.EMBEDDED_STORE, 5, null, "roads", "geom", "EPSG:3857",
            PrimaryKeyDescriptor.numeric("id"), fixture.file.toString());
    }

    @AfterEach
    void teardown() {
        session.close();
    }

    private static Map<String, Object> row(String kind, Integer lanes, String name) {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("kind", kind);
        attributes.put("lanes", lanes);
        attributes.put("name", name);
        return attributes;
    }

    private static InMemoryFeatureSource sameRowsInMemory() {
        return new InMemoryFeatureSource().register("roads_mem", List.of(
            new Feature(1L, null, row("road", 2, "Main")),
            new Feature(2L, null, row("road", 1, null)),
            new Feature(3L, null, row("path", null, "Trail")),
            new Feature(4L, null, row("river", 0, "Seine")),
            new Feature(5L, null, row("road", 4, "Ring"))
        ));
    }

    private static List<AttributeFilter> filters() {
        return List.of(
            AttributeFilter.of(new AttributeCondition("kind", ComparisonOperator.EQUALS, "road"), new AttributeCondition("lanes", ComparisonOperator.GREATER_THAN, 1)),
            AttributeFilter.of(new AttributeCondition("kind", ComparisonOperator.IN, List.of("road", "path")), new AttributeCondition("name", ComparisonOperator.IS_NOT_NULL, null)),
            AttributeFilter.of(new AttributeCondition("lanes", ComparisonOperator.LESS_OR_EQUAL, 1)),
            AttributeFilter.of(new AttributeCondition("kind", ComparisonOperator.NOT_EQUALS, "road")),
            AttributeFilter.of(new AttributeCondition("name", ComparisonOperator.IS_NULL, null))
        );
    }

    private List<Object> selectIds(String where) throws SQLException {
        List<Object> ids = new ArrayList<>();
        try (Connection connection = fixture.getConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT \"id\" FROM \"roads\" WHERE " + where + " ORDER BY \"id\"")) {
            while (resultSet.next()) {
                ids.add(resultSet.getLong(1));
            }
        }
        return ids;
    }

    private static List<Object> sorted(List<Object> ids) {
        List<Object> copy = new ArrayList<>(ids);
        copy.sort((a, b) -> Long.compare(((Number) a).longValue(), ((Number) b).longValue()));
        return copy;
    }

    @Test
    void attribute_filter_selects_matching_rows() {
        BuildOptions options = BuildOptions.defaults().withAttributeFilter(filters().get(0));
        BuiltExpression built = backend.builder().build(null, PredicateSet.empty(), CombineOperator.AND, BufferConfig.none(), roads, options);

        FilterResult result = backend.executor().execute(new ExecutionRequest(session, roads, built, CancellationToken.create()));

        assertTrue(result.success());
        assertEquals(List.of(1L, 5L), sorted(result.matchedIds()));
        assertEquals(built.raw(), result.filterText());
        assertFalse(result.usedOptimization());
    }

    @Test
    void every_dialect_agrees_on_attribute_filters() throws SQLException {
        LayerInfo inMemory = new LayerInfo("roads_mem", "roads", StorageKind.GENERIC_FORMAT, 5, null, "roads", "geom", "EPSG:3857",
            PrimaryKeyDescriptor.numeric("id"), null);
        FilterEngine engine = new FilterEngine(
            new BackendSelector(new GenericBackendBuilder().withFeatureSource(sameRowsInMemory()).build(), backend),
            id -> id.equals("roads") ? Optional.of(roads) : id.equals("roads_mem") ? Optional.of(inMemory) : Optional.empty(),
            FilterEngineConfig.defaults()
        );
        PostGisExpressionBuilder postgis = new PostGisExpressionBuilder();

        for (AttributeFilter filter : filters()) {
            FilterRequest request = FilterRequest.builder("roads")
                .withAttributeFilter(filter)
                .withTargets("roads", "roads_mem")
                .build();
            FilterOutcome outcome = engine.run(session, request, CancellationToken.create());
            assertEquals(FilterOutcome.Status.COMPLETE, outcome.status(), filter.toString());

            List<Object> spatialite = sorted(outcome.result("roads").orElseThrow().matchedIds());
            List<Object> generic = sorted(outcome.result("roads_mem").orElseThrow().matchedIds());
            String postgisSql = postgis.build(null, PredicateSet.empty(), CombineOperator.AND, BufferConfig.none(), roads,
                BuildOptions.defaults().withAttributeFilter(filter)).raw();

            assertEquals(generic, spatialite, filter.toString());
            assertEquals(generic, selectIds(postgisSql), filter.toString());
        }
    }

    @Test
    void one_provider_per_database_file_and_session() {
        BuildOptions options = BuildOptions.defaults().withAttributeFilter(filters().get(3));
        BuiltExpression built = backend.builder().build(null, PredicateSet.empty(), CombineOperator.AND, BufferConfig.none(), roads, options);

        backend.executor().execute(new ExecutionRequest(session, roads, built, CancellationToken.create()));
        backend.executor().execute(new ExecutionRequest(session, roads, built, CancellationToken.create()));

        assertEquals(1, providersOpened.get());
        assertEquals(2, backend.metrics().snapshot().executions());
    }

    @Test
    void cancelled_token_stops_before_reading() {
        BuildOptions options = BuildOptions.defaults().withAttributeFilter(filters().get(3));
        BuiltExpression built = backend.builder().build(null, PredicateSet.empty(), CombineOperator.AND, BufferConfig.none(), roads, options);
        CancellationToken token = CancellationToken.create();
        token.cancel();

        assertThrows(FilterCancelledException.class,
            () -> backend.executor().execute(new ExecutionRequest(session, roads, built, token)));
    }

    @Test
    void layer_without_a_file_is_rejected() {
        LayerInfo detached = new LayerInfo("roads", "roads", StorageKind.EMBEDDED_STORE, 5, null, "roads", "geom", "EPSG:3857",
            PrimaryKeyDescriptor.numeric("id"), null);
        FilterEngine engine = new FilterEngine(
            new BackendSelector(new GenericBackendBuilder().withFeatureSource(sameRowsInMemory()).build(), backend),
            id -> Optional.of(detached),
            FilterEngineConfig.defaults()
        );

        FilterRequest request = FilterRequest.builder("roads")
            .withAttributeFilter(filters().get(2))
            .withTargets("roads")
            .build();
        FilterResult result = engine.run(session, request, CancellationToken.create()).result("roads").orElseThrow();

        assertFalse(result.success());
        assertTrue(result.errorMessage().contains("has no database file"), result.errorMessage());
    }
}
