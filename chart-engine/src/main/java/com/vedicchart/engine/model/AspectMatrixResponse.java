package com.vedicchart.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.aspect.AspectAnalyzer;
import com.vedicchart.common.aspect.AspectMatrix;
import com.vedicchart.common.aspect.AspectMode;
import com.vedicchart.common.aspect.MutualAspect;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.chart.ChartAnalyzer;
import com.vedicchart.common.chart.ChartContext;

import java.util.List;

public record AspectMatrixResponse(
    @JsonProperty("traceId") String traceId,
    @JsonProperty("mode") AspectMode mode,
    @JsonProperty("complete") boolean complete,
    @JsonProperty("missingBodies") List<Body> missingBodies,
    @JsonProperty("matrix") AspectMatrix matrix,
    @JsonProperty("mutualAspects") List<MutualAspect> mutualAspects
) {
    public static AspectMatrixResponse from(ChartContext chart, String traceId) {
        AspectMatrix matrix = ChartAnalyzer.aspectMatrix(chart);
        return new AspectMatrixResponse(traceId, chart.aspectMode(), chart.isComplete(),
            chart.missingBodies(), matrix, AspectAnalyzer.mutualAspects(matrix));
    }
}
