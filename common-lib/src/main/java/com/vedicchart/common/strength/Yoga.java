package com.vedicchart.common.strength;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.catalog.Body;

import java.util.List;

/**
 * A detected combination.
 *
 * @param house  house the yoga was found from
 * @param houses every house the yoga links, {@code house} first
 * @param bodies bodies forming the yoga
 */
public record Yoga(
    @JsonProperty("type") YogaType type,
    @JsonProperty("house") int house,
    @JsonProperty("houses") List<Integer> houses,
    @JsonProperty("bodies") List<Body> bodies,
    @JsonProperty("description") String description
) {
    public Yoga {
        houses = List.copyOf(houses);
        bodies = List.copyOf(bodies);
    }

    @JsonProperty("name")
    public String name() {
        return type.displayName();
    }
}
