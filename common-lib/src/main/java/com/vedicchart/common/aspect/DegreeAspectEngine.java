package com.vedicchart.common.aspect;

import com.vedicchart.common.angle.AngleMath;
import com.vedicchart.common.model.BodyPosition;

import java.util.ArrayList;
import java.util.List;

/**
 * Orb-based aspects. For each effective angle the aspect point is
 * {@code source + angle}; its distance to the target longitude is classified by
 * {@link OrbCategory}. The strongest qualifying angle is primary (first in angle-set order
 * on ties); all qualifying angles are retained and summed.
 *
 * <p>Dignity for the drishti effect is evaluated at the primary aspect point.
 */
public final class DegreeAspectEngine implements AspectEngine {

    public static final DegreeAspectEngine INSTANCE = new DegreeAspectEngine();

    private DegreeAspectEngine() {}

    @Override
    public AspectMode mode() {
        return AspectMode.DEGREE;
    }

    @Override
    public AspectResult aspect(BodyPosition source, AspectTarget target) {
        double distance = AngleMath.angularDistance(source.longitude(), target.longitude());
        if (target.isBody(source.body())) {
            return AspectResult.none(source.body(), target, mode(), distance);
        }

        List<AspectHit> hits = new ArrayList<>();
        AspectHit primary = null;
        for (int angle : AspectAngles.effective(source)) {
            double aspectPoint = AngleMath.normalizeDegrees(source.longitude() + angle);
            double orb = AngleMath.angularDistance(aspectPoint, target.longitude());
            OrbCategory category = OrbCategory.classify(orb);
            if (!category.isAspect()) {
                continue;
            }
            AspectHit hit = AspectHit.withOrb(angle, orb, category);
            hits.add(hit);
            if (primary == null || hit.strength() > primary.strength()) {
                primary = hit;
            }
        }
        if (primary == null) {
            return AspectResult.none(source.body(), target, mode(), distance);
        }

        double total = hits.stream().mapToDouble(AspectHit::strength).sum();
        double aspectPoint = AngleMath.normalizeDegrees(source.longitude() + primary.angle());
        DrishtiAssessment drishti = DrishtiClassifier.assess(source.body(), aspectPoint, mode(), primary.strength());

        return new AspectResult(source.body(), target, mode(), distance, hits,
            primary.angle(), primary.category(), primary.strength(), total, drishti);
    }
}
