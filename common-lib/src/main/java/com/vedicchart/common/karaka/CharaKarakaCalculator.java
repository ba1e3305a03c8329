package com.vedicchart.common.karaka;

import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.model.BodyPosition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Eight-karaka scheme: Sun through Saturn plus Rahu ranked by degrees in sign, highest first.
 * Ketu takes no karaka; Rahu moves backwards, so it ranks by {@code 30 − degrees}.
 * Equal degrees keep catalog order. A chart with fewer bodies fills fewer karakas.
 */
public final class CharaKarakaCalculator {

    private CharaKarakaCalculator() {}

    public static List<KarakaAssignment> assign(Collection<BodyPosition> positions) {
        List<BodyPosition> ranked = positions.stream()
            .filter(p -> p.body() != Body.KETU)
            .sorted(Comparator.comparingDouble(CharaKarakaCalculator::effectiveDegree).reversed()
                .thenComparingInt(p -> p.body().ordinal()))
            .collect(Collectors.toList());

        CharaKaraka[] karakas = CharaKaraka.values();
        List<KarakaAssignment> result = new ArrayList<>();
        for (int i = 0; i < ranked.size() && i < karakas.length; i++) {
            BodyPosition p = ranked.get(i);
            result.add(new KarakaAssignment(karakas[i], p.body(), effectiveDegree(p)));
        }
        return result;
    }

    public static Optional<Body> atmakaraka(Collection<BodyPosition> positions) {
        return assign(positions).stream().findFirst().map(KarakaAssignment::body);
    }

    static double effectiveDegree(BodyPosition position) {
        return position.body() == Body.RAHU
            ? Sign.SPAN - position.degreesInSign()
            : position.degreesInSign();
    }
}
