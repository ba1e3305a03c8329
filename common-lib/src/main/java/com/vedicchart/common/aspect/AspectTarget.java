package com.vedicchart.common.aspect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.model.BodyPosition;
import com.vedicchart.common.model.House;

/**
 * What an aspect lands on: a body or a house. Degree mode tests {@code longitude}
 * (a house's cusp); sign mode tests {@code sign}.
 */
public record AspectTarget(
    @JsonProperty("kind") Kind kind,
    @JsonProperty("body") Body body,          // null for house targets
    @JsonProperty("house") Integer house,     // null for body targets
    @JsonProperty("longitude") double longitude,
    @JsonProperty("sign") Sign sign
) {
    public enum Kind { BODY, HOUSE }

    public static AspectTarget of(BodyPosition position) {
        return new AspectTarget(Kind.BODY, position.body(), null, position.longitude(), position.sign());
    }

    public static AspectTarget of(House house) {
        return new AspectTarget(Kind.HOUSE, null, house.number(), house.cusp(), house.sign());
    }

    public String label() {
        return kind == Kind.BODY ? body.displayName() : "House " + house;
    }

    public boolean isBody(Body candidate) {
        return kind == Kind.BODY && body == candidate;
    }
}
