package com.vedicchart.common.chart;

import com.vedicchart.common.aspect.AspectAnalyzer;
import com.vedicchart.common.aspect.AspectEngines;
import com.vedicchart.common.aspect.AspectMatrix;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.dignity.Dignity;
import com.vedicchart.common.dignity.DignityEngine;
import com.vedicchart.common.house.HouseBuilder;
import com.vedicchart.common.karaka.CharaKarakaCalculator;
import com.vedicchart.common.model.BodyPosition;
import com.vedicchart.common.strength.ChartStrengthEvaluator;
import com.vedicchart.common.strength.HouseStrength;
import com.vedicchart.common.strength.HouseStrengthScorer;
import com.vedicchart.common.strength.Yoga;
import com.vedicchart.common.strength.YogaDetector;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs the dignity, aspect, strength, yoga and karaka stages over an assembled chart.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class ChartAnalyzer {

    private ChartAnalyzer() {}

    public static ChartAnalysis analyze(ChartContext chart) {
        List<BodyPosition> bodies = chart.bodyPositions();

        Map<Body, Dignity> dignities = new EnumMap<>(Body.class);
        bodies.forEach(p -> dignities.put(p.body(), DignityEngine.dignity(p.body(), p.longitude())));

        AspectMatrix aspects = aspectMatrix(chart);

        List<Body> sandhi = List.of();
        List<HouseStrength> strengths = List.of();
        List<Yoga> yogas = List.of();
        List<Yoga> rajaYogas = List.of();
        Yoga dhana = null;
        if (chart.housesAvailable()) {
            sandhi = bodies.stream()
                .filter(p -> HouseBuilder.isInSandhi(p.longitude(), chart.houses()))
                .map(BodyPosition::body)
                .collect(Collectors.toList());
            strengths = HouseStrengthScorer.scoreAll(chart.houses(), chart.positions(), aspects);
            yogas = YogaDetector.detectAll(chart.houses(), chart.positions(), chart.conjunctionOrb());
            rajaYogas = YogaDetector.rajaYogas(chart.houses(), chart.positions());
            dhana = YogaDetector.dhanaPotential(chart.houses(), chart.positions()).orElse(null);
        }

        return new ChartAnalysis(
            chart,
            Collections.unmodifiableMap(dignities),
            sandhi,
            aspects,
            AspectAnalyzer.patterns(aspects, bodies, chart.conjunctionOrb()),
            AspectAnalyzer.summary(aspects, bodies, chart.conjunctionOrb()),
            strengths,
            yogas,
            rajaYogas,
            dhana,
            CharaKarakaCalculator.assign(bodies),
            ChartAssembler.specialPoints(chart),
            ChartStrengthEvaluator.evaluate(bodies, strengths));
    }

    /** Directed matrix in the chart's own mode; house targets only when houses exist. */
    public static AspectMatrix aspectMatrix(ChartContext chart) {
        return AspectMatrix.compute(AspectEngines.forMode(chart.aspectMode()),
            chart.bodyPositions(), chart.houses());
    }
}
