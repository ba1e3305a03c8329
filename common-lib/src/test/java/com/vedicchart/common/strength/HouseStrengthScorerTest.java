package com.vedicchart.common.strength;

import com.vedicchart.common.aspect.AspectHit;
import com.vedicchart.common.aspect.AspectMatrix;
import com.vedicchart.common.aspect.AspectMode;
import com.vedicchart.common.aspect.AspectResult;
import com.vedicchart.common.aspect.AspectTarget;
import com.vedicchart.common.aspect.RasiAspectEngine;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.house.HouseBuilder;
import com.vedicchart.common.model.BodyPosition;
import com.vedicchart.common.model.House;
import com.vedicchart.common.position.PositionDeriver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HouseStrengthScorerTest {

    private static final double EPS = 1e-9;

    private static Map<Body, BodyPosition> chart(BodyPosition... positions) {
        Map<Body, BodyPosition> map = new EnumMap<>(Body.class);
        for (BodyPosition p : positions) {
            map.put(p.body(), p);
        }
        return map;
    }

    private static BodyPosition at(Body body, double longitude, double speed) {
        return PositionDeriver.derive(body, longitude, 0.0, speed);
    }

    // ── factors ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("individual factors")
    class FactorTests {

        @Test
        @DisplayName("base factor by house nature")
        void base() {
            assertEquals(1.0, HouseStrengthScorer.baseFactor(1));
            assertEquals(0.8, HouseStrengthScorer.baseFactor(4));
            assertEquals(0.8, HouseStrengthScorer.baseFactor(5));
            assertEquals(0.8, HouseStrengthScorer.baseFactor(10));
            assertEquals(0.6, HouseStrengthScorer.baseFactor(3));
            assertEquals(0.6, HouseStrengthScorer.baseFactor(6));
            assertEquals(0.2, HouseStrengthScorer.baseFactor(8));
            assertEquals(0.5, HouseStrengthScorer.baseFactor(2));
        }

        @Test
        @DisplayName("sign factor averages element and quality")
        void sign() {
            assertEquals(0.7, HouseStrengthScorer.signFactor(Sign.ARIES), EPS);
            assertEquals(0.7, HouseStrengthScorer.signFactor(Sign.TAURUS), EPS);
            assertEquals(0.5, HouseStrengthScorer.signFactor(Sign.GEMINI), EPS);
            assertEquals(0.6, HouseStrengthScorer.signFactor(Sign.PISCES), EPS);
        }

        @Test
        @DisplayName("lord factor: placement, dignity and retrograde")
        void lord() {
            Map<Body, BodyPosition> kendraRetro = chart(at(Body.MARS, 190.0, -0.2));
            List<House> houses = HouseBuilder.build(0.0, kendraRetro.values());
            assertEquals(0.6, HouseStrengthScorer.lordFactor(houses.get(0), houses, kendraRetro), EPS);

            Map<Body, BodyPosition> debilitated = chart(at(Body.MARS, 100.0, 0.5));
            assertEquals(0.4, HouseStrengthScorer.lordFactor(houses.get(0), houses, debilitated), EPS);

            Map<Body, BodyPosition> dusthana = chart(at(Body.MARS, 160.0, 0.5));
            assertEquals(0.3, HouseStrengthScorer.lordFactor(houses.get(0), houses, dusthana), EPS);
        }

        @Test
        @DisplayName("missing lord scores zero")
        void missingLord() {
            List<House> houses = HouseBuilder.build(0.0, List.of());
            assertEquals(0.0, HouseStrengthScorer.lordFactor(houses.get(0), houses, Map.of()));
        }

        @Test
        @DisplayName("occupant factor is the mean of clamped per-body scores")
        void occupants() {
            Map<Body, BodyPosition> positions = chart(at(Body.JUPITER, 95.0, 0.1), at(Body.SATURN, 100.0, 0.1));
            House fourth = HouseBuilder.build(0.0, positions.values()).get(3);
            assertEquals(0.725, HouseStrengthScorer.occupantFactor(fourth, positions), EPS);

            Map<Body, BodyPosition> mercury = chart(at(Body.MERCURY, 60.0, 1.0));
            House third = HouseBuilder.build(0.0, mercury.values()).get(2);
            assertEquals(0.8, HouseStrengthScorer.occupantFactor(third, mercury), EPS);

            House empty = HouseBuilder.build(0.0, List.of()).get(0);
            assertEquals(0.3, HouseStrengthScorer.occupantFactor(empty, Map.of()));
        }

        @Test
        @DisplayName("aspect factor weights benefic ×1.2 and malefic ×0.8, capped at 1")
        void aspects() {
            House first = HouseBuilder.build(0.0, List.of()).get(0);
            AspectResult fromSaturn = wholeSign(Body.SATURN, first);
            AspectResult fromJupiter = wholeSign(Body.JUPITER, first);
            AspectResult fromMercury = wholeSign(Body.MERCURY, first);

            assertEquals(0.3, HouseStrengthScorer.aspectFactor(List.of()));
            assertEquals(0.8, HouseStrengthScorer.aspectFactor(List.of(fromSaturn)), EPS);
            assertEquals(1.0, HouseStrengthScorer.aspectFactor(List.of(fromJupiter)), EPS);
            assertEquals(1.0, HouseStrengthScorer.aspectFactor(List.of(fromMercury)), EPS);
            assertEquals(1.0, HouseStrengthScorer.aspectFactor(List.of(fromSaturn, fromJupiter)), EPS);
        }

        private AspectResult wholeSign(Body source, House target) {
            return new AspectResult(source, AspectTarget.of(target), AspectMode.RASI, 180.0,
                List.of(AspectHit.wholeSign(180)), 180, null, 1.0, 1.0, null);
        }
    }

    // ── composite ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("score()")
    class ScoreTests {

        @Test
        @DisplayName("empty, unaspected 8th in Gemini with a debilitated lord lands in the Weak band")
        void weakEighth() {
            // Scorpio rising: 8th house is Gemini; its lord Mercury sits debilitated in Pisces (5th)
            Map<Body, BodyPosition> positions = chart(at(Body.MERCURY, 340.0, 1.0));
            List<House> houses = HouseBuilder.build(210.0, positions.values());
            AspectMatrix matrix = AspectMatrix.compute(RasiAspectEngine.INSTANCE, positions.values(), houses);

            HouseStrength eighth = HouseStrengthScorer.score(houses.get(7), houses, positions, matrix);

            assertEquals(8, eighth.house());
            assertEquals(0.2, eighth.base(), EPS);
            assertEquals(0.4, eighth.lord(), EPS);
            assertEquals(0.3, eighth.occupant(), EPS);
            assertEquals(0.3, eighth.aspect(), EPS);
            assertEquals(0.5, eighth.sign(), EPS);
            assertEquals(0.2 * 0.2 + 0.3 * 0.4 + 0.25 * 0.3 + 0.15 * 0.3 + 0.1 * 0.5, eighth.total(), EPS);
            assertEquals(StrengthCategory.WEAK, eighth.category());
            assertEquals(List.of("Weak base", "Weak occupant", "Weak aspect"), eighth.contributors());
        }

        @Test
        @DisplayName("totals stay inside [0, 1] and rankings are ordered")
        void rankings() {
            Map<Body, BodyPosition> positions = chart(
                at(Body.SUN, 10.0, 1.0), at(Body.MOON, 33.0, 13.0), at(Body.JUPITER, 95.0, 0.1),
                at(Body.SATURN, 20.0, -0.05), at(Body.MARS, 100.0, 0.6));
            List<House> houses = HouseBuilder.build(0.0, positions.values());
            AspectMatrix matrix = AspectMatrix.compute(RasiAspectEngine.INSTANCE, positions.values(), houses);

            List<HouseStrength> all = HouseStrengthScorer.scoreAll(houses, positions, matrix);
            assertEquals(12, all.size());
            all.forEach(h -> assertTrue(h.total() >= 0.0 && h.total() <= 1.0));

            List<HouseStrength> strongest = HouseStrengthScorer.strongest(all, 3);
            List<HouseStrength> weakest = HouseStrengthScorer.weakest(all, 3);
            assertEquals(3, strongest.size());
            assertTrue(strongest.get(0).total() >= strongest.get(2).total());
            assertTrue(weakest.get(0).total() <= weakest.get(2).total());
            assertTrue(strongest.get(2).total() >= weakest.get(2).total());
        }

        @Test
        @DisplayName("lord distance counts houses to the lord's placement")
        void lordDistance() {
            Map<Body, BodyPosition> positions = chart(at(Body.MARS, 125.0, 0.5));
            List<House> houses = HouseBuilder.build(0.0, positions.values());
            assertEquals(4, HouseStrengthScorer.lordDistance(houses.get(0), houses, positions).getAsInt());
            assertEquals(12, HouseStrengthScorer.lordDistance(houses.get(4), houses, chart(at(Body.SUN, 125.0, 1.0))).getAsInt());
            assertTrue(HouseStrengthScorer.lordDistance(houses.get(1), houses, positions).isEmpty());
        }
    }

    @Test
    @DisplayName("category cut points are inclusive")
    void categories() {
        assertEquals(StrengthCategory.VERY_STRONG, StrengthCategory.of(0.8));
        assertEquals(StrengthCategory.STRONG, StrengthCategory.of(0.6));
        assertEquals(StrengthCategory.MODERATE, StrengthCategory.of(0.59));
        assertEquals(StrengthCategory.WEAK, StrengthCategory.of(0.2));
        assertEquals(StrengthCategory.VERY_WEAK, StrengthCategory.of(0.19));
        assertTrue(StrengthCategory.VERY_STRONG.isAtLeast(StrengthCategory.STRONG));
        assertFalse(StrengthCategory.MODERATE.isAtLeast(StrengthCategory.STRONG));
    }
}
