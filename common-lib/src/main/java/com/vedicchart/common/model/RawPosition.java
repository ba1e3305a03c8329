package com.vedicchart.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One body's state as delivered by the ephemeris collaborator: tropical ecliptic
 * longitude and latitude in degrees, and signed daily motion in degrees per day.
 */
public record RawPosition(
    @JsonProperty("longitude") double longitude,
    @JsonProperty("latitude") double latitude,
    @JsonProperty("speed") double speed
) {
    public static RawPosition of(double longitude, double latitude, double speed) {
        return new RawPosition(longitude, latitude, speed);
    }
}
