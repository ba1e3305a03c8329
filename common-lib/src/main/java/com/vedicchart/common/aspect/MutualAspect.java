package com.vedicchart.common.aspect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.catalog.Body;

public record MutualAspect(
    @JsonProperty("first") Body first,
    @JsonProperty("second") Body second,
    @JsonProperty("firstToSecond") AspectResult firstToSecond,
    @JsonProperty("secondToFirst") AspectResult secondToFirst
) {
    @JsonProperty("combinedStrength")
    public double combinedStrength() {
        return firstToSecond.totalStrength() + secondToFirst.totalStrength();
    }
}
