package com.vedicchart.engine.provider;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.model.RawPosition;

import java.util.Map;

/**
 * Tropical positions for one instant and place as returned by the ephemeris collaborator.
 *
 * @param ascendant tropical ascendant, null when the collaborator did not compute one
 */
public record EphemerisSnapshot(
    @JsonProperty("positions") Map<Body, RawPosition> positions,
    @JsonProperty("ascendant") Double ascendant
) {
    public EphemerisSnapshot {
        positions = positions == null ? Map.of() : Map.copyOf(positions);
    }

    public static EphemerisSnapshot empty() {
        return new EphemerisSnapshot(Map.of(), null);
    }
}
