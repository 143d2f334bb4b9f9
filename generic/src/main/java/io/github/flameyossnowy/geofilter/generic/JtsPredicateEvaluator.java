package io.github.flameyossnowy.geofilter.generic;

import io.github.flameyossnowy.geofilter.api.predicate.CombineOperator;
import io.github.flameyossnowy.geofilter.api.predicate.PredicateRegistry;
import io.github.flameyossnowy.geofilter.api.predicate.SpatialPredicate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates {@code predicate(target, source)} for every predicate of a plan.
 * <p>
 * The source may consist of several parts (one per source feature when buffers are
 * per-feature). A target matches when a single part satisfies the combined predicate tests,
 * the same semantics as a correlated {@code EXISTS} over the source table.
 */
public final class JtsPredicateEvaluator {
    private final List<SpatialPredicate> predicates;
    private final CombineOperator operator;
    private final List<PreparedGeometry> parts;
    private final boolean envelopeShortcut;

    public JtsPredicateEvaluator(List<String> predicateNames, CombineOperator operator, List<Geometry> sourceParts) {
        this.predicates = new ArrayList<>(predicateNames.size());
        for (String name : predicateNames) {
            predicates.add(PredicateRegistry.lookup(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown predicate: " + name)));
        }
        this.operator = operator;

        PreparedGeometryFactory factory = new PreparedGeometryFactory();
        this.parts = new ArrayList<>(sourceParts.size());
        for (Geometry part : sourceParts) {
            if (part != null && !part.isEmpty()) {
                parts.add(factory.create(part));
            }
        }

        // Every predicate except DISJOINT needs the envelopes to meet.
        this.envelopeShortcut = operator == CombineOperator.AND
            ? predicates.stream().anyMatch(predicate -> predicate != SpatialPredicate.DISJOINT)
            : predicates.stream().noneMatch(predicate -> predicate == SpatialPredicate.DISJOINT);
    }

    public boolean hasSource() {
        return !parts.isEmpty();
    }

    public boolean matches(Geometry target) {
        if (target == null || target.isEmpty()) {
            return false;
        }

        Envelope envelope = target.getEnvelopeInternal();
        for (PreparedGeometry part : parts) {
            if (envelopeShortcut && !part.getGeometry().getEnvelopeInternal().intersects(envelope)) {
                continue;
            }
            if (matchesPart(part, target)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesPart(PreparedGeometry source, Geometry target) {
        boolean and = operator == CombineOperator.AND;
        for (SpatialPredicate predicate : predicates) {
            boolean result = test(predicate, source, target);
            if (and && !result) {
                return false;
            }
            if (!and && result) {
                return true;
            }
        }
        return and;
    }

    static boolean test(SpatialPredicate predicate, PreparedGeometry source, Geometry target) {
        return switch (predicate) {
            case INTERSECTS -> source.intersects(target);
            case WITHIN -> source.contains(target);
            case CONTAINS -> source.within(target);
            case CONTAINS_PROPERLY -> target.relate(source.getGeometry(), "T**FF*FF*");
            case COVERS -> source.coveredBy(target);
            case COVERED_BY -> source.covers(target);
            case DISJOINT -> source.disjoint(target);
            case TOUCHES -> source.touches(target);
            case CROSSES -> source.crosses(target);
            case OVERLAPS -> source.overlaps(target);
            case EQUALS -> source.getGeometry().equalsTopo(target);
        };
    }
}
