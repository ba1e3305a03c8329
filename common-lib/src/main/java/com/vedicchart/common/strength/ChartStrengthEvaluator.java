package com.vedicchart.common.strength;

import com.vedicchart.common.dignity.Dignity;
import com.vedicchart.common.dignity.DignityEngine;
import com.vedicchart.common.model.BodyPosition;

import java.util.Collection;
import java.util.List;

/**
 * Overall chart strength as a point tally.
 *
 * <p>Each body scores +3 exalted, +2 own sign or moolatrikona, −2 debilitated, +1 otherwise,
 * out of 3. Two bonus points (out of 2) when at least {@value #STRONG_HOUSE_QUORUM} houses
 * rate Strong or better. The category uses the same 0.8/0.6/0.4/0.2 cut points as houses.
 */
public final class ChartStrengthEvaluator {

    public static final int POINTS_PER_BODY = 3;
    public static final int HOUSE_BONUS = 2;
    public static final int STRONG_HOUSE_QUORUM = 3;

    private ChartStrengthEvaluator() {}

    public static ChartStrength evaluate(Collection<BodyPosition> positions, List<HouseStrength> houseStrengths) {
        int points = 0;
        int max = 0;
        for (BodyPosition position : positions) {
            points += bodyPoints(DignityEngine.dignity(position.body(), position.longitude()));
            max += POINTS_PER_BODY;
        }
        if (!houseStrengths.isEmpty()) {
            long strong = houseStrengths.stream()
                .filter(h -> h.category().isAtLeast(StrengthCategory.STRONG))
                .count();
            if (strong >= STRONG_HOUSE_QUORUM) {
                points += HOUSE_BONUS;
            }
            max += HOUSE_BONUS;
        }
        double percentage = max == 0 ? 0.0 : Math.max(0.0, points * 100.0 / max);
        return new ChartStrength(points, max, percentage, StrengthCategory.of(percentage / 100.0));
    }

    static int bodyPoints(Dignity dignity) {
        if (dignity.isExalted()) return 3;
        if (dignity.isOwnOrMoolatrikona()) return 2;
        if (dignity.isDebilitated()) return -2;
        return 1;
    }
}
