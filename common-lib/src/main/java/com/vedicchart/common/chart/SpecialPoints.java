package com.vedicchart.common.chart;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sidereal derived points. A field is null when an input it needs is missing.
 *
 * @param midheaven     ascendant + 270
 * @param partOfFortune ascendant + Moon − Sun
 */
public record SpecialPoints(
    @JsonProperty("midheaven") Double midheaven,
    @JsonProperty("partOfFortune") Double partOfFortune
) {}
