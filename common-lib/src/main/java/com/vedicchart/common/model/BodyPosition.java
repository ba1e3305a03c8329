package com.vedicchart.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.catalog.Nakshatra;
import com.vedicchart.common.catalog.Sign;

/**
 * A body's sidereal state at the chart instant plus the fields derived from its longitude.
 * Built once by {@link com.vedicchart.common.position.PositionDeriver}; immutable.
 */
public record BodyPosition(
    @JsonProperty("body") Body body,
    @JsonProperty("longitude") double longitude,     // sidereal, [0, 360)
    @JsonProperty("latitude") double latitude,
    @JsonProperty("speed") double speed,             // degrees/day, negative while retrograde
    @JsonProperty("sign") Sign sign,
    @JsonProperty("degreesInSign") double degreesInSign,
    @JsonProperty("nakshatra") Nakshatra nakshatra,
    @JsonProperty("pada") int pada
) {
    @JsonProperty("retrograde")
    public boolean retrograde() {
        return speed < 0;
    }
}
