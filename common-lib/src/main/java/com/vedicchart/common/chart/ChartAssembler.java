package com.vedicchart.common.chart;

import com.vedicchart.common.angle.AngleMath;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.house.HouseBuilder;
import com.vedicchart.common.model.BodyPosition;
import com.vedicchart.common.model.House;
import com.vedicchart.common.model.RawPosition;
import com.vedicchart.common.position.PositionDeriver;
import com.vedicchart.common.time.AyanamsaSystem;
import com.vedicchart.common.time.JulianDay;
import com.vedicchart.common.time.SiderealConverter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link ChartContext} from raw tropical input.
 *
 * <ol>
 *   <li>Julian Day and ayanamsa for the instant</li>
 *   <li>Ketu = Rahu + 180 (same latitude negated, same speed) when only Rahu was supplied</li>
 *   <li>each body converted to sidereal and derived</li>
 *   <li>ascendant: supplied value converted to sidereal, else the LST fallback when enabled,
 *       else none</li>
 *   <li>equal houses from the ascendant</li>
 * </ol>
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class ChartAssembler {

    private ChartAssembler() {}

    public static ChartContext assemble(ChartInput input) {
        double jd = JulianDay.of(input.timestamp());
        AyanamsaSystem system = input.ayanamsa();

        Map<Body, RawPosition> raw = withDerivedKetu(input.positions());

        Map<Body, BodyPosition> positions = new EnumMap<>(Body.class);
        List<Body> missing = new ArrayList<>();
        for (Body body : Body.values()) {
            RawPosition r = raw.get(body);
            if (r == null) {
                missing.add(body);
                continue;
            }
            double sidereal = SiderealConverter.tropicalToSidereal(r.longitude(), jd, system);
            positions.put(body, PositionDeriver.derive(body, sidereal, r.latitude(), r.speed()));
        }

        Double ascendant = null;
        boolean fromFallback = false;
        if (input.tropicalAscendant() != null) {
            ascendant = SiderealConverter.tropicalToSidereal(input.tropicalAscendant(), jd, system);
        } else if (input.ascendantFallbackEnabled()) {
            ascendant = SiderealConverter.fallbackAscendant(jd, input.latitude(), input.longitude(), system);
            fromFallback = true;
        }

        List<House> houses = ascendant == null
            ? List.of()
            : HouseBuilder.build(ascendant, positions.values());

        return new ChartContext(input.timestamp(), jd, system, system.valueAt(jd), input.aspectMode(),
            ascendant, fromFallback, positions, houses, missing, input.conjunctionOrb());
    }

    public static SpecialPoints specialPoints(ChartContext chart) {
        Double ascendant = chart.ascendant();
        if (ascendant == null) {
            return new SpecialPoints(null, null);
        }
        Double midheaven = AngleMath.normalizeDegrees(ascendant + 270.0);
        BodyPosition sun = chart.positions().get(Body.SUN);
        BodyPosition moon = chart.positions().get(Body.MOON);
        Double fortune = sun == null || moon == null
            ? null
            : AngleMath.normalizeDegrees(ascendant + moon.longitude() - sun.longitude());
        return new SpecialPoints(midheaven, fortune);
    }

    static Map<Body, RawPosition> withDerivedKetu(Map<Body, RawPosition> supplied) {
        Map<Body, RawPosition> raw = new EnumMap<>(Body.class);
        raw.putAll(supplied);
        RawPosition rahu = raw.get(Body.RAHU);
        if (rahu != null && !raw.containsKey(Body.KETU)) {
            raw.put(Body.KETU, RawPosition.of(
                AngleMath.normalizeDegrees(rahu.longitude() + 180.0), -rahu.latitude(), rahu.speed()));
        }
        return raw;
    }
}
