package io.github.flameyossnowy.geofilter.api.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.flameyossnowy.geofilter.api.expression.CentroidMode;
import io.github.flameyossnowy.geofilter.api.layer.CrsSupport;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Tunables of the engine and its backends, bound from JSON.
 * <p>
 * {@link #defaults()} reads {@code geofilter-defaults.json} from the classpath;
 * {@link #load(Path)} overlays a user file on top of those defaults, so a file only needs
 * the keys it changes.
 *
 * @param materializationThreshold  target feature count from which a relational filter is materialized
 * @param simpleWktMaxFeatures      source feature count up to which the source geometry is inlined
 * @param maxWktLength              source WKT length up to which the source geometry is inlined
 * @param simplifyWktThreshold      inlined sources with longer WKT are simplified before buffering
 * @param metricSrid                projected CRS geographic sources are buffered in
 * @param defaultSegments           buffer segments per quarter circle
 * @param centroidMode              centroid used when a request substitutes centroids
 * @param fetchSize                 JDBC fetch size when reading matched ids
 * @param cancellationCheckInterval rows read between two cancellation checks
 * @param materializedViewSchema    schema holding session-scoped materialized result sets
 * @param materializedViewPrefix    name prefix of those result sets
 * @param pool                      connection-pool settings, per store and session
 */
public record FilterEngineConfig(
    int materializationThreshold,
    int simpleWktMaxFeatures,
    int maxWktLength,
    int simplifyWktThreshold,
    int metricSrid,
    int defaultSegments,
    @NotNull CentroidMode centroidMode,
    int fetchSize,
    int cancellationCheckInterval,
    @NotNull String materializedViewSchema,
    @NotNull String materializedViewPrefix,
    @NotNull PoolSettings pool
) {
    static final String DEFAULTS_RESOURCE = "/geofilter-defaults.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public FilterEngineConfig {
        Objects.requireNonNull(centroidMode, "centroidMode cannot be null");
        Objects.requireNonNull(materializedViewSchema, "materializedViewSchema cannot be null");
        Objects.requireNonNull(materializedViewPrefix, "materializedViewPrefix cannot be null");
        Objects.requireNonNull(pool, "pool cannot be null");
        if (materializationThreshold < 0 || simpleWktMaxFeatures < 0 || maxWktLength < 0 || simplifyWktThreshold < 0) {
            throw new IllegalArgumentException("Thresholds cannot be negative");
        }
        if (fetchSize <= 0 || cancellationCheckInterval <= 0 || defaultSegments <= 0) {
            throw new IllegalArgumentException("fetchSize, cancellationCheckInterval and defaultSegments must be positive");
        }
        if (CrsSupport.isGeographic(metricSrid)) {
            throw new IllegalArgumentException("metricSrid cannot be a geographic CRS: " + metricSrid);
        }
        if (!materializedViewPrefix.matches("[a-z_][a-z0-9_]*")) {
            throw new IllegalArgumentException("materializedViewPrefix must be a lower-case identifier: " + materializedViewPrefix);
        }
    }

    public static FilterEngineConfig defaults() {
        try {
            return MAPPER.treeToValue(defaultsTree(), FilterEngineConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind " + DEFAULTS_RESOURCE, e);
        }
    }

    public static FilterEngineConfig load(@NotNull Path file) {
        try {
            JsonNode overrides = MAPPER.readTree(Files.readAllBytes(file));
            if (!overrides.isObject()) {
                throw new IllegalArgumentException("Configuration root must be a JSON object: " + file);
            }

            ObjectNode merged = defaultsTree();
            merge(merged, (ObjectNode) overrides);
            return MAPPER.treeToValue(merged, FilterEngineConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + file, e);
        }
    }

    public FilterEngineConfig withMaterializationThreshold(int materializationThreshold) {
        return new FilterEngineConfig(materializationThreshold, simpleWktMaxFeatures, maxWktLength, simplifyWktThreshold, metricSrid,
            defaultSegments, centroidMode, fetchSize, cancellationCheckInterval, materializedViewSchema, materializedViewPrefix, pool);
    }

    public FilterEngineConfig withCancellationCheckInterval(int cancellationCheckInterval) {
        return new FilterEngineConfig(materializationThreshold, simpleWktMaxFeatures, maxWktLength, simplifyWktThreshold, metricSrid,
            defaultSegments, centroidMode, fetchSize, cancellationCheckInterval, materializedViewSchema, materializedViewPrefix, pool);
    }

    public FilterEngineConfig withDefaultSegments(int defaultSegments) {
        return new FilterEngineConfig(materializationThreshold, simpleWktMaxFeatures, maxWktLength, simplifyWktThreshold, metricSrid,
            defaultSegments, centroidMode, fetchSize, cancellationCheckInterval, materializedViewSchema, materializedViewPrefix, pool);
    }

    private static ObjectNode defaultsTree() throws IOException {
        try (InputStream in = FilterEngineConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return (ObjectNode) MAPPER.readTree(in);
        }
    }

    private static void merge(ObjectNode target, ObjectNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> fields = overrides.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing instanceof ObjectNode existingObject && field.getValue() instanceof ObjectNode overrideObject) {
                merge(existingObject, overrideObject);
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }

    /**
     * @param minimumIdle             idle connections kept per pool
     * @param maximumPoolSize         connections per pool
     * @param connectionTimeoutMillis wait for a free connection before failing
     * @param idleTimeoutMillis       idle time before a connection is retired
     */
    public record PoolSettings(int minimumIdle, int maximumPoolSize, long connectionTimeoutMillis, long idleTimeoutMillis) {
        public PoolSettings {
            if (maximumPoolSize <= 0 || minimumIdle < 0 || minimumIdle > maximumPoolSize) {
                throw new IllegalArgumentException("Invalid pool bounds: min " + minimumIdle + ", max " + maximumPoolSize);
            }
        }
    }
}
