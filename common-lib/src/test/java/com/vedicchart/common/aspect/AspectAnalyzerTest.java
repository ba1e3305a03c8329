package com.vedicchart.common.aspect;

import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.house.HouseBuilder;
import com.vedicchart.common.model.BodyPosition;
import com.vedicchart.common.model.House;
import com.vedicchart.common.position.PositionDeriver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sun 10°, Mercury 15°, Moon 190° in degree mode: Sun and Moon oppose exactly,
 * Mercury and Moon oppose within 5°, Sun and Mercury are 5° apart. Ascendant 10°.
 */
class AspectAnalyzerTest {

    private List<BodyPosition> positions;
    private AspectMatrix matrix;

    @BeforeEach
    void setUp() {
        positions = List.of(
            PositionDeriver.derive(Body.SUN, 10.0, 0.0, 1.0),
            PositionDeriver.derive(Body.MOON, 190.0, 0.0, 13.0),
            PositionDeriver.derive(Body.MERCURY, 15.0, 0.0, 1.2));
        List<House> houses = HouseBuilder.build(10.0, positions);
        matrix = AspectMatrix.compute(DegreeAspectEngine.INSTANCE, positions, houses);
    }

    @Nested
    @DisplayName("AspectMatrix")
    class MatrixTests {

        @Test
        @DisplayName("rows cover every present body and all twelve houses")
        void shape() {
            assertEquals(3, matrix.toBodies().size());
            assertEquals(3, matrix.toBodies().get(Body.SUN).size());
            assertEquals(12, matrix.toHouses().get(Body.MOON).size());
            assertEquals(AspectMode.DEGREE, matrix.mode());
        }

        @Test
        @DisplayName("between() looks up a directed pair")
        void between() {
            assertEquals(OrbCategory.EXACT, matrix.between(Body.SUN, Body.MOON).orElseThrow().category());
            assertFalse(matrix.between(Body.SUN, Body.MERCURY).orElseThrow().aspecting());
            assertTrue(matrix.between(Body.SUN, Body.JUPITER).isEmpty());
        }

        @Test
        @DisplayName("incoming aspects are ordered strongest first")
        void toBody() {
            List<AspectResult> onMoon = matrix.aspectsToBody(Body.MOON);
            assertEquals(List.of(Body.SUN, Body.MERCURY), onMoon.stream().map(AspectResult::source).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("house 7 (cusp 190°) receives the Sun and Mercury oppositions")
        void toHouse() {
            List<AspectResult> onSeventh = matrix.aspectsToHouse(7);
            assertEquals(2, onSeventh.size());
            assertEquals(Body.SUN, onSeventh.get(0).source());
        }
    }

    @Nested
    @DisplayName("patterns and summary")
    class PatternTests {

        @Test
        @DisplayName("Sun–Mercury conjunction at 5° is Moderate")
        void conjunction() {
            List<Conjunction> conjunctions = AspectAnalyzer.conjunctions(positions, 8.0);
            assertEquals(1, conjunctions.size());
            Conjunction c = conjunctions.get(0);
            assertEquals(Body.SUN, c.first());
            assertEquals(Body.MERCURY, c.second());
            assertEquals(Conjunction.Closeness.MODERATE, c.closeness());
            assertTrue(AspectAnalyzer.conjunctions(positions, 4.0).isEmpty());
        }

        @Test
        @DisplayName("mutual aspects need both directions")
        void mutual() {
            List<MutualAspect> mutual = AspectAnalyzer.mutualAspects(matrix);
            assertEquals(2, mutual.size());
            assertEquals(2.0, mutual.get(0).combinedStrength(), 1e-12);
        }

        @Test
        @DisplayName("summary counts and most aspected body")
        void summary() {
            AspectSummary summary = AspectAnalyzer.summary(matrix, positions, 8.0);
            assertEquals(4, summary.totalAspects());
            assertEquals(0.75, summary.averageStrength(), 1e-12);
            assertEquals(2, summary.strongAspectsCount());
            assertEquals(2, summary.exactAspectsCount());
            assertEquals(1, summary.totalConjunctions());
            assertEquals(Map.of(180, 4), summary.angleDistribution());
            assertEquals(Body.MOON, summary.mostAspectedBody());
            assertEquals(Body.MOON, summary.mostAspectingBody());
        }
    }

    @Nested
    @DisplayName("DrishtiSummary")
    class DrishtiSummaryTests {

        @Test
        @DisplayName("no aspects → No major aspects")
        void empty() {
            DrishtiSummary summary = DrishtiSummary.of(List.of());
            assertEquals(0, summary.totalAspects());
            assertEquals(DrishtiSummary.NO_MAJOR_ASPECTS, summary.overallInfluence());
            assertNull(summary.strongestAspect());
        }

        @Test
        @DisplayName("malefic oppositions on the Moon read Predominantly Inauspicious")
        void moon() {
            DrishtiSummary summary = DrishtiSummary.of(matrix.aspectsToBody(Body.MOON));
            assertEquals(2, summary.totalAspects());
            assertEquals(1, summary.maleficAspects());
            assertEquals(1, summary.neutralAspects());
            assertEquals(Body.SUN, summary.strongestAspect().source());
            assertEquals(DrishtiSummary.PREDOMINANTLY_INAUSPICIOUS, summary.overallInfluence());
        }
    }
}
