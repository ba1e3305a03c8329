package com.vedicchart.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.aspect.AspectMode;
import com.vedicchart.common.aspect.AspectPatterns;
import com.vedicchart.common.aspect.AspectSummary;
import com.vedicchart.common.aspect.DrishtiSummary;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.chart.ChartAnalysis;
import com.vedicchart.common.chart.ChartContext;
import com.vedicchart.common.chart.SpecialPoints;
import com.vedicchart.common.dignity.Dignity;
import com.vedicchart.common.house.Bhava;
import com.vedicchart.common.karaka.KarakaAssignment;
import com.vedicchart.common.model.BodyPosition;
import com.vedicchart.common.model.House;
import com.vedicchart.common.strength.ChartStrength;
import com.vedicchart.common.strength.HouseStrength;
import com.vedicchart.common.strength.HouseStrengthScorer;
import com.vedicchart.common.strength.Yoga;
import com.vedicchart.common.time.AyanamsaSystem;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Outbound view of one analysed chart. {@code complete} is false when bodies are missing or
 * the chart has no houses; the house-dependent lists are then empty.
 */
public record ChartResponse(
    @JsonProperty("traceId") String traceId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("julianDay") double julianDay,
    @JsonProperty("ayanamsaSystem") AyanamsaSystem ayanamsaSystem,
    @JsonProperty("ayanamsa") double ayanamsa,
    @JsonProperty("aspectMode") AspectMode aspectMode,
    @JsonProperty("ascendant") Double ascendant,
    @JsonProperty("ascendantFromFallback") boolean ascendantFromFallback,
    @JsonProperty("complete") boolean complete,
    @JsonProperty("housesAvailable") boolean housesAvailable,
    @JsonProperty("missingBodies") List<Body> missingBodies,
    @JsonProperty("bodies") List<BodyPosition> bodies,
    @JsonProperty("dignities") Map<Body, Dignity> dignities,
    @JsonProperty("sandhiBodies") List<Body> sandhiBodies,
    @JsonProperty("houses") List<HouseDetail> houses,
    @JsonProperty("strongestHouses") List<HouseStrength> strongestHouses,
    @JsonProperty("weakestHouses") List<HouseStrength> weakestHouses,
    @JsonProperty("aspectSummary") AspectSummary aspectSummary,
    @JsonProperty("aspectPatterns") AspectPatterns aspectPatterns,
    @JsonProperty("yogas") List<Yoga> yogas,
    @JsonProperty("rajaYogas") List<Yoga> rajaYogas,
    @JsonProperty("dhanaYoga") Yoga dhanaYoga,
    @JsonProperty("karakas") List<KarakaAssignment> karakas,
    @JsonProperty("specialPoints") SpecialPoints specialPoints,
    @JsonProperty("chartStrength") ChartStrength chartStrength
) {
    static final int RANKED_HOUSES = 3;

    public static ChartResponse from(ChartAnalysis analysis, String traceId) {
        ChartContext chart = analysis.chart();

        List<HouseDetail> houses = new ArrayList<>();
        for (HouseStrength strength : analysis.houseStrengths()) {
            House house = chart.house(strength.house());
            OptionalInt distance = HouseStrengthScorer.lordDistance(house, chart.houses(), chart.positions());
            houses.add(new HouseDetail(
                house,
                Bhava.of(house.number()).displayName(),
                house.madhya(),
                distance.isPresent() ? distance.getAsInt() : null,
                strength,
                DrishtiSummary.of(analysis.aspects().aspectsToHouse(house.number()))));
        }

        return new ChartResponse(
            traceId,
            chart.timestamp(),
            chart.julianDay(),
            chart.ayanamsaSystem(),
            chart.ayanamsa(),
            chart.aspectMode(),
            chart.ascendant(),
            chart.ascendantFromFallback(),
            chart.isComplete(),
            chart.housesAvailable(),
            chart.missingBodies(),
            chart.bodyPositions(),
            analysis.dignities(),
            analysis.sandhiBodies(),
            houses,
            HouseStrengthScorer.strongest(analysis.houseStrengths(), RANKED_HOUSES),
            HouseStrengthScorer.weakest(analysis.houseStrengths(), RANKED_HOUSES),
            analysis.aspectSummary(),
            analysis.patterns(),
            analysis.yogas(),
            analysis.rajaYogas(),
            analysis.dhanaYoga(),
            analysis.karakas(),
            analysis.specialPoints(),
            analysis.chartStrength());
    }
}
