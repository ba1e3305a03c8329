package com.vedicchart.common.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A sign plus a degree within it, e.g. the exaltation point "Aries 10°".
 */
public record ZodiacPoint(
    @JsonProperty("sign") Sign sign,
    @JsonProperty("degree") double degree
) {
    public double longitude() {
        return sign.startLongitude() + degree;
    }

    /** True when {@code degreesInSign} lies within {@code orb} of this point's degree. */
    public boolean isWithin(double degreesInSign, double orb) {
        return Math.abs(degreesInSign - degree) <= orb;
    }
}
