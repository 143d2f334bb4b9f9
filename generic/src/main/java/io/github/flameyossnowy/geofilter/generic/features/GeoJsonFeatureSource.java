package io.github.flameyossnowy.geofilter.generic.features;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.flameyossnowy.geofilter.api.exceptions.FilterException;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a GeoJSON {@code FeatureCollection} from the layer's source file.
 * <p>
 * The feature id is the property named by the layer's primary key, or the GeoJSON
 * {@code id} member when that property is absent. Features with neither are skipped.
 */
public final class GeoJsonFeatureSource implements FeatureSource {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @NotNull
    @Override
    public Iterable<Feature> features(@NotNull LayerInfo layer) {
        if (layer.source() == null) {
            throw new FilterException("Layer " + layer.id() + " has no source file");
        }

        Path file = Path.of(layer.source());
        JsonNode root;
        try {
            root = MAPPER.readTree(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new FilterException("Failed to read " + file + ": " + e.getMessage(), e);
        }

        if (!"FeatureCollection".equals(root.path("type").asText())) {
            throw new FilterException(file + " is not a GeoJSON FeatureCollection");
        }

        GeometryFactory factory = new GeometryFactory(new PrecisionModel(), layer.srid());
        String keyName = layer.primaryKey().name();
        List<Feature> features = new ArrayList<>();
        int skipped = 0;

        for (JsonNode node : root.path("features")) {
            Map<String, Object> attributes = properties(node.path("properties"));
            Object id = attributes.get(keyName);
            if (id == null && node.hasNonNull("id")) {
                id = scalar(node.get("id"));
            }
            if (id == null) {
                skipped++;
                continue;
            }

            JsonNode geometry = node.get("geometry");
            features.add(new Feature(id, geometry == null || geometry.isNull() ? null : geometry(geometry, factory), attributes));
        }

        if (skipped > 0) {
            Logging.warn("Skipped " + skipped + " features without an id in " + file);
        }
        return features;
    }

    private static Map<String, Object> properties(JsonNode properties) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            attributes.put(field.getKey(), scalar(field.getValue()));
        }
        return attributes;
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        return node.toString();
    }

    static Geometry geometry(JsonNode node, GeometryFactory factory) {
        String type = node.path("type").asText();
        JsonNode coordinates = node.path("coordinates");
        switch (type) {
            case "Point":
                return factory.createPoint(coordinate(coordinates));
            case "LineString":
                return factory.createLineString(coordinates(coordinates));
            case "Polygon":
                return polygon(coordinates, factory);
            case "MultiPoint": {
                List<Point> points = new ArrayList<>();
                for (JsonNode point : coordinates) {
                    points.add(factory.createPoint(coordinate(point)));
                }
                return factory.createMultiPoint(points.toArray(new Point[0]));
            }
            case "MultiLineString": {
                List<LineString> lines = new ArrayList<>();
                for (JsonNode line : coordinates) {
                    lines.add(factory.createLineString(coordinates(line)));
                }
                return factory.createMultiLineString(lines.toArray(new LineString[0]));
            }
            case "MultiPolygon": {
                List<Polygon> polygons = new ArrayList<>();
                for (JsonNode polygon : coordinates) {
                    polygons.add(polygon(polygon, factory));
                }
                return factory.createMultiPolygon(polygons.toArray(new Polygon[0]));
            }
            case "GeometryCollection": {
                List<Geometry> members = new ArrayList<>();
                for (JsonNode member : node.path("geometries")) {
                    members.add(geometry(member, factory));
                }
                return factory.createGeometryCollection(members.toArray(new Geometry[0]));
            }
            default:
                throw new FilterException("Unsupported GeoJSON geometry type: " + type);
        }
    }

    private static Polygon polygon(JsonNode rings, GeometryFactory factory) {
        if (rings.size() == 0) {
            return factory.createPolygon();
        }
        LinearRing shell = factory.createLinearRing(coordinates(rings.get(0)));
        LinearRing[] holes = new LinearRing[rings.size() - 1];
        for (int i = 1; i < rings.size(); i++) {
            holes[i - 1] = factory.createLinearRing(coordinates(rings.get(i)));
        }
        return factory.createPolygon(shell, holes);
    }

    private static Coordinate[] coordinates(JsonNode array) {
        Coordinate[] coordinates = new Coordinate[array.size()];
        for (int i = 0; i < coordinates.length; i++) {
            coordinates[i] = coordinate(array.get(i));
        }
        return coordinates;
    }

    private static Coordinate coordinate(JsonNode position) {
        if (position.size() < 2) {
            throw new FilterException("GeoJSON position needs at least two ordinates: " + position);
        }
        return new Coordinate(position.get(0).doubleValue(), position.get(1).doubleValue());
    }
}
