package io.github.flameyossnowy.geofilter.api.source;

import io.github.flameyossnowy.geofilter.api.cache.CacheKey;
import io.github.flameyossnowy.geofilter.api.cache.Fingerprints;
import io.github.flameyossnowy.geofilter.api.exceptions.FilterException;
import io.github.flameyossnowy.geofilter.api.layer.LayerInfo;
import io.github.flameyossnowy.geofilter.api.session.FilterSession;
import io.github.flameyossnowy.geofilter.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Prepares the source geometry once per session and picks, per target, whether the filter
 * embeds it as a literal or correlates against the source table.
 */
public final class SourceGeometryResolver {
    private final int simpleWktMaxFeatures;
    private final int maxWktLength;

    public SourceGeometryResolver(int simpleWktMaxFeatures, int maxWktLength) {
        this.simpleWktMaxFeatures = simpleWktMaxFeatures;
        this.maxWktLength = maxWktLength;
    }

    @NotNull
    public PreparedSource prepare(@NotNull FilterSession session, @NotNull String sourceLayerId, @NotNull SourceGeometry source) {
        if (source.isEmpty()) {
            throw new FilterException("Source layer " + sourceLayerId + " has no selected features");
        }

        List<String> parts = new ArrayList<>(source.features().size() + 1);
        parts.add(source.crsCode());
        for (SourceFeature feature : source.features()) {
            parts.add(feature.wkt());
            parts.add(feature.attributes().toString());
        }
        String fingerprint = Fingerprints.md5(parts);

        CacheKey key = new CacheKey(session.id(), sourceLayerId, fingerprint);
        Optional<PreparedSource> cached = session.geometryCache().get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        PreparedSource prepared = parse(source, fingerprint);
        session.geometryCache().put(key, prepared);
        Logging.info(() -> "Prepared source geometry of layer " + sourceLayerId + " (" + prepared.featureCount() + " features)");
        return prepared;
    }

    /**
     * Same store and too large to inline: correlate. Everything else, including every
     * cross-store pair, embeds the geometry literally.
     */
    @NotNull
    public SourceGeometryRef resolve(@NotNull SourceGeometry source, @NotNull PreparedSource prepared, @NotNull LayerInfo target) {
        LayerInfo sourceLayer = source.layer();
        boolean small = prepared.featureCount() <= simpleWktMaxFeatures && prepared.wkt().length() <= maxWktLength;

        if (sourceLayer != null && sourceLayer.sharesStoreWith(target) && !small) {
            return new SourceGeometryRef.TableReference(
                sourceLayer.schema(),
                sourceLayer.table(),
                sourceLayer.geometryColumn(),
                source.sourceFilter(),
                sourceLayer.srid(),
                sourceLayer.isGeoPackage()
            );
        }

        return literal(prepared);
    }

    @NotNull
    public SourceGeometryRef.Literal literal(@NotNull PreparedSource prepared) {
        return new SourceGeometryRef.Literal(prepared.wkt(), prepared.srid(), prepared.features(), prepared.mixedCollection());
    }

    private static PreparedSource parse(SourceGeometry source, String fingerprint) {
        int srid = source.srid();
        GeometryFactory factory = new GeometryFactory(new PrecisionModel(), srid);
        WKTReader reader = new WKTReader(factory);

        List<Geometry> geometries = new ArrayList<>(source.features().size());
        for (SourceFeature feature : source.features()) {
            try {
                geometries.add(reader.read(feature.wkt()));
            } catch (ParseException e) {
                throw new FilterException("Source geometry is not valid WKT: " + abbreviate(feature.wkt()), e);
            }
        }

        Geometry combined = factory.buildGeometry(geometries);
        combined.setSRID(srid);
        return new PreparedSource(combined, new WKTWriter().write(combined), srid, source.features(), fingerprint);
    }

    private static String abbreviate(String wkt) {
        return wkt.length() <= 80 ? wkt : wkt.substring(0, 77) + "...";
    }
}
