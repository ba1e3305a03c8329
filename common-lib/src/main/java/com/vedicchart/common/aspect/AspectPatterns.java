package com.vedicchart.common.aspect;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Chart-wide aspect groupings. Strong means total strength ≥ 0.75, weak ≤ 0.25, exact
 * means the primary hit is in the exact orb band (degree mode only).
 */
public record AspectPatterns(
    @JsonProperty("conjunctions") List<Conjunction> conjunctions,
    @JsonProperty("mutualAspects") List<MutualAspect> mutualAspects,
    @JsonProperty("strongAspects") List<AspectResult> strongAspects,
    @JsonProperty("weakAspects") List<AspectResult> weakAspects,
    @JsonProperty("exactAspects") List<AspectResult> exactAspects
) {}
