package com.vedicchart.common.aspect;

import com.vedicchart.common.angle.AngleMath;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.model.BodyPosition;

import java.util.ArrayList;
import java.util.List;

/**
 * Sign-based aspects: each effective angle marks the whole sign
 * {@code (sourceSign + angle / 30) mod 12} at strength 1.0. No orbs.
 *
 * <p>Dignity for the drishti effect is evaluated at the middle (15°) of the aspected sign.
 */
public final class RasiAspectEngine implements AspectEngine {

    public static final RasiAspectEngine INSTANCE = new RasiAspectEngine();

    private RasiAspectEngine() {}

    @Override
    public AspectMode mode() {
        return AspectMode.RASI;
    }

    @Override
    public AspectResult aspect(BodyPosition source, AspectTarget target) {
        double distance = AngleMath.angularDistance(source.longitude(), target.longitude());
        if (target.isBody(source.body())) {
            return AspectResult.none(source.body(), target, mode(), distance);
        }

        List<AspectHit> hits = new ArrayList<>();
        for (int angle : AspectAngles.effective(source)) {
            Sign aspected = source.sign().offset(AspectAngles.signOffset(angle));
            if (aspected == target.sign()) {
                hits.add(AspectHit.wholeSign(angle));
            }
        }
        if (hits.isEmpty()) {
            return AspectResult.none(source.body(), target, mode(), distance);
        }

        AspectHit primary = hits.get(0);
        double total = hits.stream().mapToDouble(AspectHit::strength).sum();
        double midSign = target.sign().startLongitude() + Sign.SPAN / 2.0;
        DrishtiAssessment drishti = DrishtiClassifier.assess(source.body(), midSign, mode(), primary.strength());

        return new AspectResult(source.body(), target, mode(), distance, hits,
            primary.angle(), null, primary.strength(), total, drishti);
    }
}
