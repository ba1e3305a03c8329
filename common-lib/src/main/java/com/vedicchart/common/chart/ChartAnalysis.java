package com.vedicchart.common.chart;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.aspect.AspectMatrix;
import com.vedicchart.common.aspect.AspectPatterns;
import com.vedicchart.common.aspect.AspectSummary;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.dignity.Dignity;
import com.vedicchart.common.karaka.KarakaAssignment;
import com.vedicchart.common.strength.ChartStrength;
import com.vedicchart.common.strength.HouseStrength;
import com.vedicchart.common.strength.Yoga;

import java.util.List;
import java.util.Map;

/**
 * Everything derived from a {@link ChartContext}. House-dependent lists are empty when the
 * chart has no houses; {@code dhanaYoga} is null when a wealth lord is missing.
 */
public record ChartAnalysis(
    @JsonProperty("chart") ChartContext chart,
    @JsonProperty("dignities") Map<Body, Dignity> dignities,
    @JsonProperty("sandhiBodies") List<Body> sandhiBodies,
    @JsonProperty("aspects") AspectMatrix aspects,
    @JsonProperty("patterns") AspectPatterns patterns,
    @JsonProperty("aspectSummary") AspectSummary aspectSummary,
    @JsonProperty("houseStrengths") List<HouseStrength> houseStrengths,
    @JsonProperty("yogas") List<Yoga> yogas,
    @JsonProperty("rajaYogas") List<Yoga> rajaYogas,
    @JsonProperty("dhanaYoga") Yoga dhanaYoga,
    @JsonProperty("karakas") List<KarakaAssignment> karakas,
    @JsonProperty("specialPoints") SpecialPoints specialPoints,
    @JsonProperty("chartStrength") ChartStrength chartStrength
) {}
