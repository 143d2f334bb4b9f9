package io.github.flameyossnowy.geofilter.api.predicate;

import io.github.flameyossnowy.geofilter.api.layer.Dialect;
import org.jetbrains.annotations.Nullable;

/**
 * Spatial relationship tests between a target geometry (first argument) and the source geometry.
 * <p>
 * {@link #selectivity()} is static domain knowledge: a lower value rejects more candidates
 * and is evaluated first.
 */
public enum SpatialPredicate {
    WITHIN("within", 1, "ST_Within", "Within", "within"),
    CONTAINS("contains", 2, "ST_Contains", "Contains", "contains"),
    CONTAINS_PROPERLY("containsproperly", 2, "ST_ContainsProperly", null, "containsProperly"),
    DISJOINT("disjoint", 3, "ST_Disjoint", "Disjoint", "disjoint"),
    EQUALS("equals", 4, "ST_Equals", "Equals", "equals"),
    TOUCHES("touches", 5, "ST_Touches", "Touches", "touches"),
    CROSSES("crosses", 6, "ST_Crosses", "Crosses", "crosses"),
    OVERLAPS("overlaps", 7, "ST_Overlaps", "Overlaps", "overlaps"),
    COVERED_BY("coveredby", 8, "ST_CoveredBy", "CoveredBy", "coveredBy"),
    COVERS("covers", 9, "ST_Covers", "Covers", "covers"),
    INTERSECTS("intersects", 10, "ST_Intersects", "Intersects", "intersects");

    private final String canonicalName;
    private final int selectivity;
    private final String postgisSymbol;
    private final String spatialiteSymbol;
    private final String genericSymbol;

    SpatialPredicate(String canonicalName, int selectivity, String postgisSymbol, String spatialiteSymbol, String genericSymbol) {
        this.canonicalName = canonicalName;
        this.selectivity = selectivity;
        this.postgisSymbol = postgisSymbol;
        this.spatialiteSymbol = spatialiteSymbol;
        this.genericSymbol = genericSymbol;
    }

    public String canonicalName() {
        return canonicalName;
    }

    public int selectivity() {
        return selectivity;
    }

    @Nullable
    public String symbol(Dialect dialect) {
        return switch (dialect) {
            case POSTGIS -> postgisSymbol;
            case SPATIALITE -> spatialiteSymbol;
            case GENERIC -> genericSymbol;
        };
    }
}
