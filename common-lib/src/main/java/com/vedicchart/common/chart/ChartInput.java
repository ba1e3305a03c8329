package com.vedicchart.common.chart;

import com.vedicchart.common.aspect.AspectAnalyzer;
import com.vedicchart.common.aspect.AspectMode;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.model.RawPosition;
import com.vedicchart.common.time.AyanamsaSystem;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a chart is built from. Positions and the ascendant are tropical, as supplied by
 * the ephemeris collaborator; bodies absent from {@code positions} end up in the chart's
 * missing list.
 *
 * @param tropicalAscendant null when the collaborator could not supply one
 */
public record ChartInput(
    Instant timestamp,
    double latitude,
    double longitude,
    AyanamsaSystem ayanamsa,
    AspectMode aspectMode,
    Map<Body, RawPosition> positions,
    Double tropicalAscendant,
    double conjunctionOrb,
    boolean ascendantFallbackEnabled
) {
    public ChartInput {
        Objects.requireNonNull(timestamp, "timestamp");
        ayanamsa = ayanamsa == null ? AyanamsaSystem.DEFAULT : ayanamsa;
        aspectMode = aspectMode == null ? AspectMode.RASI : aspectMode;
        Map<Body, RawPosition> copy = new EnumMap<>(Body.class);
        if (positions != null) {
            positions.forEach((body, raw) -> {
                if (body != null && raw != null) {
                    copy.put(body, raw);
                }
            });
        }
        positions = Collections.unmodifiableMap(copy);
    }

    /** Lahiri, rasi mode, default orb, fallback ascendant enabled. */
    public static ChartInput of(Instant timestamp, double latitude, double longitude,
                                Map<Body, RawPosition> positions, Double tropicalAscendant) {
        return new ChartInput(timestamp, latitude, longitude, AyanamsaSystem.DEFAULT, AspectMode.RASI,
            positions, tropicalAscendant, AspectAnalyzer.DEFAULT_CONJUNCTION_ORB, true);
    }

    public ChartInput withAspectMode(AspectMode mode) {
        return new ChartInput(timestamp, latitude, longitude, ayanamsa, mode, positions,
            tropicalAscendant, conjunctionOrb, ascendantFallbackEnabled);
    }

    public ChartInput withAyanamsa(AyanamsaSystem system) {
        return new ChartInput(timestamp, latitude, longitude, system, aspectMode, positions,
            tropicalAscendant, conjunctionOrb, ascendantFallbackEnabled);
    }
}
