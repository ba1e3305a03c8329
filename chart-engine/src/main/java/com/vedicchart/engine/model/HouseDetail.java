package com.vedicchart.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.aspect.DrishtiSummary;
import com.vedicchart.common.model.House;
import com.vedicchart.common.strength.HouseStrength;

/**
 * @param lordDistance houses counted from this house to its lord, null when the lord is missing
 */
public record HouseDetail(
    @JsonProperty("house") House house,
    @JsonProperty("name") String name,
    @JsonProperty("madhya") double madhya,
    @JsonProperty("lordDistance") Integer lordDistance,
    @JsonProperty("strength") HouseStrength strength,
    @JsonProperty("influences") DrishtiSummary influences
) {}
