package com.vedicchart.common.aspect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.catalog.Body;

import java.util.Map;

public record AspectSummary(
    @JsonProperty("totalAspects") int totalAspects,
    @JsonProperty("averageStrength") double averageStrength,
    @JsonProperty("totalConjunctions") int totalConjunctions,
    @JsonProperty("totalMutualAspects") int totalMutualAspects,
    @JsonProperty("strongAspectsCount") int strongAspectsCount,
    @JsonProperty("exactAspectsCount") int exactAspectsCount,
    @JsonProperty("angleDistribution") Map<Integer, Integer> angleDistribution,  // primary angle → count
    @JsonProperty("mostAspectedBody") Body mostAspectedBody,
    @JsonProperty("mostAspectingBody") Body mostAspectingBody
) {}
