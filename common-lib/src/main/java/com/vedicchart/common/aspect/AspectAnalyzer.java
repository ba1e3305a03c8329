package com.vedicchart.common.aspect;

import com.vedicchart.common.angle.AngleMath;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.model.BodyPosition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Chart-wide views over an {@link AspectMatrix}: conjunctions, mutual aspects, strength
 * patterns and the summary counts.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class AspectAnalyzer {

    public static final double DEFAULT_CONJUNCTION_ORB = 8.0;
    public static final double STRONG_ASPECT = 0.75;
    public static final double WEAK_ASPECT = 0.25;

    private AspectAnalyzer() {}

    /** Pairs of bodies within {@code orb} degrees, each pair reported once. */
    public static List<Conjunction> conjunctions(Collection<BodyPosition> positions, double orb) {
        List<BodyPosition> ordered = inCatalogOrder(positions);
        List<Conjunction> result = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            for (int j = i + 1; j < ordered.size(); j++) {
                BodyPosition a = ordered.get(i);
                BodyPosition b = ordered.get(j);
                double distance = AngleMath.angularDistance(a.longitude(), b.longitude());
                if (distance <= orb) {
                    result.add(new Conjunction(a.body(), b.body(), distance, Conjunction.Closeness.of(distance)));
                }
            }
        }
        return result;
    }

    /** Pairs where each body aspects the other. */
    public static List<MutualAspect> mutualAspects(AspectMatrix matrix) {
        List<Body> bodies = new ArrayList<>(matrix.toBodies().keySet());
        List<MutualAspect> result = new ArrayList<>();
        for (int i = 0; i < bodies.size(); i++) {
            for (int j = i + 1; j < bodies.size(); j++) {
                Body a = bodies.get(i);
                Body b = bodies.get(j);
                AspectResult ab = matrix.toBodies().get(a).get(b);
                AspectResult ba = matrix.toBodies().get(b).get(a);
                if (ab != null && ba != null && ab.aspecting() && ba.aspecting()) {
                    result.add(new MutualAspect(a, b, ab, ba));
                }
            }
        }
        return result;
    }

    public static AspectPatterns patterns(AspectMatrix matrix, Collection<BodyPosition> positions, double conjunctionOrb) {
        List<AspectResult> strong = new ArrayList<>();
        List<AspectResult> weak = new ArrayList<>();
        List<AspectResult> exact = new ArrayList<>();
        for (AspectResult result : matrix.bodyAspects()) {
            if (result.totalStrength() >= STRONG_ASPECT) {
                strong.add(result);
            } else if (result.totalStrength() <= WEAK_ASPECT) {
                weak.add(result);
            }
            if (result.category() == OrbCategory.EXACT) {
                exact.add(result);
            }
        }
        return new AspectPatterns(conjunctions(positions, conjunctionOrb), mutualAspects(matrix), strong, weak, exact);
    }

    public static AspectSummary summary(AspectMatrix matrix, Collection<BodyPosition> positions, double conjunctionOrb) {
        AspectPatterns patterns = patterns(matrix, positions, conjunctionOrb);
        List<AspectResult> all = matrix.bodyAspects();

        Map<Integer, Integer> distribution = new TreeMap<>();
        double totalStrength = 0.0;
        for (AspectResult result : all) {
            totalStrength += result.totalStrength();
            distribution.merge(result.primaryAngle(), 1, Integer::sum);
        }

        Map<Body, Integer> received = new EnumMap<>(Body.class);
        Map<Body, Integer> cast = new EnumMap<>(Body.class);
        for (Body body : matrix.toBodies().keySet()) {
            received.put(body, matrix.aspectsToBody(body).size());
            cast.put(body, matrix.aspectsFromBody(body).size());
        }

        return new AspectSummary(
            all.size(),
            totalStrength / Math.max(all.size(), 1),
            patterns.conjunctions().size(),
            patterns.mutualAspects().size(),
            patterns.strongAspects().size(),
            patterns.exactAspects().size(),
            distribution,
            mostFrequent(received),
            mostFrequent(cast));
    }

    // first body in catalog order wins a tie
    private static Body mostFrequent(Map<Body, Integer> counts) {
        Body best = null;
        int bestCount = -1;
        for (Map.Entry<Body, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static List<BodyPosition> inCatalogOrder(Collection<BodyPosition> positions) {
        return positions.stream()
            .sorted(Comparator.comparingInt(p -> p.body().ordinal()))
            .collect(Collectors.toList());
    }
}
