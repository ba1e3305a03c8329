package com.vedicchart.common.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A closed range of degrees inside one sign, e.g. a moolatrikona span.
 */
public record DegreeSpan(
    @JsonProperty("sign") Sign sign,
    @JsonProperty("fromDegree") double fromDegree,
    @JsonProperty("toDegree") double toDegree
) {
    /** Both ends inclusive. */
    public boolean contains(Sign candidate, double degreesInSign) {
        return sign == candidate && degreesInSign >= fromDegree && degreesInSign <= toDegree;
    }
}
