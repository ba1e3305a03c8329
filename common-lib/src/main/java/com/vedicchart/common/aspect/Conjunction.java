package com.vedicchart.common.aspect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.catalog.Body;

/**
 * Two bodies within the conjunction orb of each other; {@code first} precedes
 * {@code second} in catalog order.
 */
public record Conjunction(
    @JsonProperty("first") Body first,
    @JsonProperty("second") Body second,
    @JsonProperty("distance") double distance,
    @JsonProperty("closeness") Closeness closeness
) {
    public enum Closeness {
        VERY_CLOSE("Very Close"),
        CLOSE("Close"),
        MODERATE("Moderate"),
        WIDE("Wide");

        private final String displayName;

        Closeness(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }

        public static Closeness of(double distance) {
            if (distance <= 1.0) return VERY_CLOSE;
            if (distance <= 3.0) return CLOSE;
            if (distance <= 5.0) return MODERATE;
            return WIDE;
        }
    }

    public boolean involves(Body body) {
        return first == body || second == body;
    }
}
