import io.github.flameyossnowy.geofilter.api.backend.BackendSelector;
import io.github.flameyossnowy.geofilter.api.buffer.BufferConfig;
import io.github.flameyossnowy.geofilter.api.buffer.EndCapStyle;
import io.github.flameyossnowy.geofilter.api.buffer.JoinStyle;
import io.github.flameyossnowy.geofilter.api.engine.FilterEngine;
import io.github.flameyossnowy.geofilter.api.engine.FilterEngineConfig;
import io.github.flameyossnowy.geofilter.api.engine.FilterOutcome;
import io.github.flameyossnowy.geofilter.api.engine.FilterRequest;
import io.github.flameyossnowy.geofilter.api.exceptions.BackendConnectionException;
import io.github.flameyossnowy.geofilter.api.exceptions.FilterExecutionException;
import io.github.flameyossnowy.geofilter.api.exceptions.InvalidBufferExpressionException;
import io.github.flameyossnowy.geofilter.api.exceptions.UnsupportedFeatureException;
import io.github.flameyossnowy.geofilter.api.expression.BuiltExpression;
import io.github.flameyossnowy.geofilter.api.expression.FilterExpression;
import io.github.flameyossnowy.geofilter.api.layer.Dialect;
import io.github.flameyossnowy.geofilter.api.layer.StorageKind;
import io.github.flameyossnowy.geofilter.api.predicate.CombineOperator;
import io.github.flameyossnowy.geofilter.api.result.FilterResult;
import io.github.flameyossnowy.geofilter.api.session.CancellationToken;
import io.github.flameyossnowy.geofilter.api.session.FilterSession;
import io.github.flameyossnowy.geofilter.api.source.SourceFeature;
import io.github.flameyossnowy.geofilter.api.source.SourceGeometry;
import io.github.flameyossnowy.geofilter.api.source.SourceGeometryRef;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FilterEngineTest {
    StubBackend relational;
    StubBackend generic;
    FilterEngine engine;
    FilterSession session;

    @BeforeEach
    void setup() {
        relational = new StubBackend("postgresql", StorageKind.RELATIONAL_STORE);
        generic = new StubBackend("ogr", StorageKind.GENERIC_FORMAT);
        engine = new FilterEngine(
            new BackendSelector(generic, relational),
            Layers.catalog(Layers.relational("roads"), Layers.relational("rivers"), Layers.relational("parcels"), Layers.generic("trees")),
            FilterEngineConfig.defaults()
        );
        session = new FilterSession("engine");
    }

    @AfterEach
    void teardown() {
        session.close();
    }

    private static FilterRequest.Builder request(String... targets) {
        return FilterRequest.builder("towns")
            .withSource(SourceGeometry.of("EPSG:3857", "POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))"))
            .withPredicates("intersects")
            .withTargets(targets);
    }

    @Test
    void every_target_is_routed_to_its_backend() {
        FilterOutcome outcome = engine.run(session, request("roads", "trees").build(), CancellationToken.create());

        assertEquals(FilterOutcome.Status.COMPLETE, outcome.status());
        assertEquals("postgresql", outcome.result("roads").orElseThrow().backendName());
        assertEquals("ogr", outcome.result("trees").orElseThrow().backendName());
        assertInstanceOf(SourceGeometryRef.Literal.class, relational.seenSources.get(0));
    }

    @Test
    void failing_layer_does_not_stop_the_batch() {
        relational.executor = request -> {
            if (request.target().id().equals("rivers")) {
                throw new FilterExecutionException("postgresql", "select", "relation \"rivers\" does not exist", null);
            }
            return FilterResult.success(request.target().id(), "postgresql", List.of(1L, 2L), "x", 1, false);
        };

        FilterOutcome outcome = engine.run(session, request("roads", "rivers", "lakes", "parcels").build(), CancellationToken.create());

        assertEquals(FilterOutcome.Status.PARTIAL, outcome.status());
        assertEquals(4, outcome.results().size());
        assertTrue(outcome.result("roads").orElseThrow().success());
        assertTrue(outcome.result("parcels").orElseThrow().success());

        FilterResult rivers = outcome.result("rivers").orElseThrow();
        assertFalse(rivers.success());
        assertEquals("relation \"rivers\" does not exist", rivers.errorMessage());

        FilterResult lakes = outcome.result("lakes").orElseThrow();
        assertFalse(lakes.success());
        assertTrue(lakes.errorMessage().contains("Unknown layer"));

        assertEquals(1, relational.metrics().snapshot().errors());
    }

    @Test
    void lost_connection_on_one_layer_still_attempts_the_next() {
        AtomicInteger attempts = new AtomicInteger();
        relational.executor = request -> {
            attempts.incrementAndGet();
            if (request.target().id().equals("roads")) {
                throw new BackendConnectionException("postgresql", "connection refused", null);
            }
            return FilterResult.success(request.target().id(), "postgresql", List.of(7L), "x", 1, false);
        };

        FilterOutcome outcome = engine.run(session, request("roads", "rivers").build(), CancellationToken.create());

        assertEquals(2, attempts.get());
        assertEquals(FilterOutcome.Status.PARTIAL, outcome.status());
        assertEquals(List.of(7L), outcome.result("rivers").orElseThrow().matchedIds());
    }

    @Test
    void unsupported_request_is_rebuilt_with_the_fallback() {
        relational.buildStep = (source, predicates, target) -> {
            throw new UnsupportedFeatureException(Dialect.POSTGIS, "mixed geometry collections");
        };

        FilterOutcome outcome = engine.run(session, request("roads").build(), CancellationToken.create());

        FilterResult roads = outcome.result("roads").orElseThrow();
        assertTrue(roads.success());
        assertEquals("ogr", roads.backendName());
        assertEquals("ogr:roads", roads.filterText());
        assertInstanceOf(SourceGeometryRef.Literal.class, generic.seenSources.get(0));
        assertEquals(1, relational.metrics().snapshot().errors());
    }

    @Test
    void large_same_store_source_is_inlined_for_the_generic_backend() {
        List<SourceFeature> points = new ArrayList<>();
        for (int i = 0; i <= 100; i++) {
            points.add(SourceFeature.of("POINT (" + i + " " + i + ")"));
        }
        SourceGeometry towns = new SourceGeometry(points, "EPSG:3857", Layers.relational("towns"), null);
        generic.buildStep = (source, predicates, target) -> {
            if (!(source instanceof SourceGeometryRef.Literal)) {
                throw new IllegalStateException("Generic-format filters need an inline source geometry");
            }
            return new BuiltExpression(Dialect.GENERIC,
                new FilterExpression("ogr:" + target.id(), true, List.of()), List.of());
        };

        FilterRequest request = FilterRequest.builder("towns")
            .withSource(towns)
            .withPredicates("intersects")
            .withTargets("roads", "rivers", "trees")
            .withBackendOverride("roads", StorageKind.GENERIC_FORMAT)
            .build();
        FilterOutcome outcome = engine.run(session, request, CancellationToken.create());

        assertEquals(FilterOutcome.Status.COMPLETE, outcome.status());
        assertEquals("ogr", outcome.result("roads").orElseThrow().backendName());
        assertEquals("postgresql", outcome.result("rivers").orElseThrow().backendName());
        assertInstanceOf(SourceGeometryRef.TableReference.class, relational.seenSources.get(0));
        assertEquals(2, generic.seenSources.size());
        generic.seenSources.forEach(source -> assertInstanceOf(SourceGeometryRef.Literal.class, source));
    }

    @Test
    void unexpected_failure_is_reported_for_its_layer_only() {
        relational.buildStep = (source, predicates, target) -> {
            throw new IllegalStateException("builder state corrupted");
        };

        FilterOutcome outcome = engine.run(session, request("roads", "trees").build(), CancellationToken.create());

        assertEquals(FilterOutcome.Status.PARTIAL, outcome.status());
        FilterResult roads = outcome.result("roads").orElseThrow();
        assertFalse(roads.success());
        assertEquals("IllegalStateException: builder state corrupted", roads.errorMessage());
        assertTrue(outcome.result("trees").orElseThrow().success());
        assertEquals(1, relational.metrics().snapshot().errors());
    }

    @Test
    void cancellation_stops_before_the_next_layer() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger executed = new AtomicInteger();
        relational.executor = request -> {
            executed.incrementAndGet();
            token.cancel();
            return FilterResult.success(request.target().id(), "postgresql", List.of(1L), "x", 1, false);
        };

        FilterOutcome outcome = engine.run(session, request("roads", "rivers", "parcels").build(), token);

        assertEquals(1, executed.get());
        assertEquals(FilterOutcome.Status.CANCELLED, outcome.status());
        assertTrue(outcome.result("roads").orElseThrow().success());
        assertEquals("Cancelled", outcome.result("rivers").orElseThrow().errorMessage());
        assertEquals("Cancelled", outcome.result("parcels").orElseThrow().errorMessage());
    }

    @Test
    void malformed_buffer_expression_fails_the_whole_request() {
        BufferConfig buffer = BufferConfig.resolve("width *", 0, true, 5, EndCapStyle.ROUND, JoinStyle.ROUND);
        FilterRequest request = request("roads").withBuffer(buffer).build();

        assertThrows(InvalidBufferExpressionException.class, () -> engine.run(session, request, CancellationToken.create()));
    }

    @Test
    void existing_attribute_subset_is_combined() {
        FilterRequest request = request("roads")
            .withExistingSubset("roads", "lanes > 1")
            .withSubsetCombineOperator(CombineOperator.AND)
            .build();

        FilterOutcome outcome = engine.run(session, request, CancellationToken.create());

        assertEquals("(lanes > 1) AND (postgresql:roads)", outcome.result("roads").orElseThrow().filterText());
    }

    @Test
    void submit_runs_off_the_calling_thread() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            FilterOutcome outcome = engine.submit(session, request("roads").build(), CancellationToken.create(), executor)
                .get(10, TimeUnit.SECONDS);
            assertEquals(FilterOutcome.Status.COMPLETE, outcome.status());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void removing_a_layer_evicts_its_cached_source() {
        engine.run(session, request("roads").build(), CancellationToken.create());
        assertEquals(1, session.geometryCache().size());

        assertEquals(0, engine.removeLayer(session, "project", "towns"));
        assertEquals(0, session.geometryCache().size());
    }
}
