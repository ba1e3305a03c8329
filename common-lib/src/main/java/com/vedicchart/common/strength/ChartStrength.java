package com.vedicchart.common.strength;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChartStrength(
    @JsonProperty("points") int points,
    @JsonProperty("maxPoints") int maxPoints,
    @JsonProperty("percentage") double percentage,
    @JsonProperty("category") StrengthCategory category
) {}
