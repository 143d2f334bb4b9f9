import io.github.flameyossnowy.geofilter.api.exceptions.FilterExecutionException;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.layer.PrimaryKeyDescriptor;
import io.github.flameyossnowy.geofilter.api.layer.StorageKind;
import io.github.flameyossnowy.geofilter.api.session.FilterSession;
import io.github.flameyossnowy.geofilter.sql.execution.SqlOperationRunner;
import io.github.flameyossnowy.geofilter.sqlite.SpatiaLiteSpatialIndexManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SpatiaLiteSpatialIndexManagerTest {
    @TempDir
    Path directory;

    final SpatiaLiteSpatialIndexManager manager = new SpatiaLiteSpatialIndexManager(new SqlOperationRunner("spatialite"));
    final AtomicInteger createCalls = new AtomicInteger();
    FilterSession session;

    @BeforeEach
    void setup() {
        session = new FilterSession("index");
    }

    @AfterEach
    void teardown() {
        session.close();
    }

    private static LayerInfo layer(Path file) {
        return new LayerInfo("parcels", "parcels", StorageKind.EMBEDDED_STORE, 100, null, "parcels", "geom", "EPSG:2154",
            PrimaryKeyDescriptor.numeric("fid"), file.toString());
    }

    private SqliteFixture spatialite(int enabled, int createResult) throws SQLException {
        SqliteFixture fixture = new SqliteFixture(directory.resolve("cadastre.sqlite"))
            .withFunction("CreateSpatialIndex", SqliteFixture.counting(createCalls, createResult));
        fixture.execute(
            "CREATE TABLE geometry_columns (f_table_name TEXT, f_geometry_column TEXT, spatial_index_enabled INTEGER)",
            "INSERT INTO geometry_columns VALUES ('Parcels', 'GEOM', " + enabled + ")"
        );
        return fixture;
    }

    @Test
    void missing_index_is_created_once_per_session() throws SQLException {
        SqliteFixture fixture = spatialite(0, 1);
        LayerInfo parcels = layer(fixture.file);

        assertEquals("idx_parcels_geom", manager.ensureIndex(session, fixture, parcels));
        assertEquals("idx_parcels_geom", manager.ensureIndex(session, fixture, parcels));

        assertEquals(1, createCalls.get());
        assertEquals(1, fixture.connections.get());
    }

    @Test
    void enabled_index_is_not_recreated() throws SQLException {
        SqliteFixture fixture = spatialite(1, 1);

        assertEquals("idx_parcels_geom", manager.ensureIndex(session, fixture, layer(fixture.file)));
        assertEquals(0, createCalls.get());
    }

    @Test
    void refused_creation_is_an_execution_error() throws SQLException {
        SqliteFixture fixture = spatialite(0, 0);

        FilterExecutionException failure = assertThrows(FilterExecutionException.class,
            () -> manager.ensureIndex(session, fixture, layer(fixture.file)));
        assertTrue(failure.getNativeMessage().contains("CreateSpatialIndex refused parcels.geom"), failure.getNativeMessage());
    }

    @Test
    void new_session_checks_again() throws SQLException {
        SqliteFixture fixture = spatialite(0, 1);
        LayerInfo parcels = layer(fixture.file);

        manager.ensureIndex(session, fixture, parcels);
        try (FilterSession next = new FilterSession("index2")) {
            manager.ensureIndex(next, fixture, parcels);
        }

        assertEquals(2, createCalls.get());
    }

    @Test
    void geopackage_rtree_is_detected() throws SQLException {
        AtomicInteger gpkgCalls = new AtomicInteger();
        SqliteFixture fixture = new SqliteFixture(directory.resolve("cadastre.gpkg"))
            .withFunction("gpkgAddSpatialIndex", SqliteFixture.counting(gpkgCalls, 1));
        fixture.execute("CREATE TABLE rtree_parcels_geom (id INTEGER PRIMARY KEY, minx REAL, maxx REAL, miny REAL, maxy REAL)");

        assertEquals("rtree_parcels_geom", manager.ensureIndex(session, fixture, layer(fixture.file)));
        assertEquals(0, gpkgCalls.get());
    }

    @Test
    void geopackage_without_rtree_gets_one() throws SQLException {
        AtomicInteger gpkgCalls = new AtomicInteger();
        SqliteFixture fixture = new SqliteFixture(directory.resolve("cadastre.gpkg"))
            .withFunction("gpkgAddSpatialIndex", SqliteFixture.counting(gpkgCalls, 0));
        fixture.execute("CREATE TABLE parcels (fid INTEGER PRIMARY KEY, geom BLOB)");

        assertEquals("rtree_parcels_geom", manager.ensureIndex(session, fixture, layer(fixture.file)));
        assertEquals(1, gpkgCalls.get());
    }
}
