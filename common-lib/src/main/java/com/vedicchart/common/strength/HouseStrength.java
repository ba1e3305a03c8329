package com.vedicchart.common.strength;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Weighted strength of one house. Every factor and the total lie in [0, 1].
 *
 * @param contributors "Strong x" for factors ≥ 0.7 and "Weak x" for factors ≤ 0.3,
 *                     in factor order
 */
public record HouseStrength(
    @JsonProperty("house") int house,
    @JsonProperty("base") double base,
    @JsonProperty("lord") double lord,
    @JsonProperty("occupant") double occupant,
    @JsonProperty("aspect") double aspect,
    @JsonProperty("sign") double sign,
    @JsonProperty("total") double total,
    @JsonProperty("category") StrengthCategory category,
    @JsonProperty("contributors") List<String> contributors
) {}
