package com.vedicchart.common.chart;

import com.vedicchart.common.aspect.AspectMode;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.dignity.Dignity;
import com.vedicchart.common.model.RawPosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ChartAnalyzerTest {

    private static final Instant J2000 = Instant.parse("2000-01-01T12:00:00Z");

    // sidereal = tropical − 23.85 at J2000
    private static Map<Body, RawPosition> fullChart() {
        Map<Body, RawPosition> raw = new EnumMap<>(Body.class);
        raw.put(Body.SUN, RawPosition.of(33.85, 0.0, 1.0));       // Aries 10, exalted
        raw.put(Body.MOON, RawPosition.of(123.85, 0.0, 13.0));    // Cancer 10, own sign
        raw.put(Body.MARS, RawPosition.of(243.85, 0.0, 0.6));     // Scorpio 10
        raw.put(Body.MERCURY, RawPosition.of(58.85, 0.0, -0.4));  // Taurus 5, retrograde
        raw.put(Body.JUPITER, RawPosition.of(118.85, 0.0, 0.1));  // Cancer 5, exalted
        raw.put(Body.VENUS, RawPosition.of(73.85, 0.0, 1.2));     // Taurus 20
        raw.put(Body.SATURN, RawPosition.of(313.85, 0.0, 0.05));  // Capricorn 20
        raw.put(Body.RAHU, RawPosition.of(93.85, 0.0, -0.05));    // Gemini 20
        return raw;
    }

    @Test
    @DisplayName("complete chart produces every derived section")
    void complete() {
        ChartAnalysis analysis = ChartAnalyzer.analyze(
            ChartAssembler.assemble(ChartInput.of(J2000, 12.97, 77.59, fullChart(), 48.85)));

        assertTrue(analysis.chart().isComplete());
        assertEquals(9, analysis.dignities().size());
        assertEquals(Dignity.EXALTED_EXACT, analysis.dignities().get(Body.SUN));
        assertEquals(Dignity.EXALTED_EXACT, analysis.dignities().get(Body.JUPITER));
        assertEquals(12, analysis.houseStrengths().size());
        assertEquals(12, analysis.aspects().toHouses().get(Body.SATURN).size());
        assertEquals(8, analysis.karakas().size());
        assertEquals(29, analysis.chartStrength().maxPoints());
        assertNotNull(analysis.specialPoints().midheaven());
        assertNotNull(analysis.dhanaYoga());
        assertEquals(AspectMode.RASI, analysis.aspects().mode());
    }

    @Test
    @DisplayName("degree mode flows from the input to the matrix")
    void degreeMode() {
        ChartInput input = ChartInput.of(J2000, 0.0, 0.0, fullChart(), 48.85).withAspectMode(AspectMode.DEGREE);
        ChartAnalysis analysis = ChartAnalyzer.analyze(ChartAssembler.assemble(input));
        assertEquals(AspectMode.DEGREE, analysis.aspects().mode());
    }

    @Test
    @DisplayName("without houses the house-dependent sections are empty")
    void withoutHouses() {
        ChartInput input = new ChartInput(J2000, 0.0, 0.0, null, null, fullChart(), null, 8.0, false);
        ChartAnalysis analysis = ChartAnalyzer.analyze(ChartAssembler.assemble(input));

        assertFalse(analysis.chart().housesAvailable());
        assertTrue(analysis.houseStrengths().isEmpty());
        assertTrue(analysis.yogas().isEmpty());
        assertTrue(analysis.rajaYogas().isEmpty());
        assertNull(analysis.dhanaYoga());
        assertTrue(analysis.sandhiBodies().isEmpty());
        assertTrue(analysis.aspects().toHouses().get(Body.SUN).isEmpty());
        assertEquals(27, analysis.chartStrength().maxPoints());
        assertNull(analysis.specialPoints().midheaven());
        assertEquals(8, analysis.karakas().size());
    }
}
