package com.vedicchart.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.model.RawPosition;

import java.time.Instant;
import java.util.Map;

/**
 * Inbound chart request. Positions and the ascendant are tropical; body keys resolve by
 * English or Sanskrit name, any case.
 *
 * @param ayanamsa   optional; unknown names resolve to Lahiri
 * @param aspectMode optional "rasi" or "degree"
 */
public record ChartRequest(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("latitude") Double latitude,
    @JsonProperty("longitude") Double longitude,
    @JsonProperty("ayanamsa") String ayanamsa,
    @JsonProperty("aspectMode") String aspectMode,
    @JsonProperty("ascendant") Double ascendant,
    @JsonProperty("positions") Map<String, RawPosition> positions
) {
    public ChartRequest {
        positions = positions == null ? Map.of() : positions;
    }
}
