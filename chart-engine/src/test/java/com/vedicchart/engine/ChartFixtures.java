package com.vedicchart.engine;

import com.vedicchart.common.aspect.AspectMode;
import com.vedicchart.common.model.RawPosition;
import com.vedicchart.common.time.AyanamsaSystem;
import com.vedicchart.engine.config.ChartSettings;
import com.vedicchart.engine.model.ChartRequest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * At J2000 Lahiri is 23.85°, so each tropical longitude below is a round sidereal one
 * plus that offset.
 */
public final class ChartFixtures {

    public static final Instant J2000 = Instant.parse("2000-01-01T12:00:00Z");
    public static final double TROPICAL_ASCENDANT = 118.85;   // sidereal 95, Cancer

    private ChartFixtures() {}

    public static ChartSettings defaults() {
        return new ChartSettings(AyanamsaSystem.LAHIRI, AspectMode.RASI, 8.0, true);
    }

    /** Sun through Rahu; Ketu is left for the assembler to derive. */
    public static Map<String, RawPosition> allPositions() {
        Map<String, RawPosition> positions = new LinkedHashMap<>();
        positions.put("Sun", RawPosition.of(33.85, 0.0, 1.0));
        positions.put("Moon", RawPosition.of(213.85, 2.0, 13.0));
        positions.put("Mars", RawPosition.of(303.85, 0.5, 0.6));
        positions.put("Mercury", RawPosition.of(58.85, 1.0, 1.2));
        positions.put("Jupiter", RawPosition.of(123.85, 0.2, 0.1));
        positions.put("Venus", RawPosition.of(3.85, -1.0, 1.1));
        positions.put("Saturn", RawPosition.of(223.85, 0.8, -0.05));
        positions.put("Rahu", RawPosition.of(83.85, 0.0, -0.05));
        return positions;
    }

    public static Map<String, RawPosition> sunAndMoon() {
        Map<String, RawPosition> positions = new LinkedHashMap<>();
        positions.put("Sun", RawPosition.of(33.85, 0.0, 1.0));
        positions.put("Moon", RawPosition.of(213.85, 2.0, 13.0));
        return positions;
    }

    public static ChartRequest request(Map<String, RawPosition> positions, Double ascendant) {
        return new ChartRequest(J2000, 28.6, 77.2, null, null, ascendant, positions);
    }
}
