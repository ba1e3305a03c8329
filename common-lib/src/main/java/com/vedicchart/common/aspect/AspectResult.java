package com.vedicchart.common.aspect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.catalog.Body;

import java.util.List;

/**
 * Directed aspect relation from a source body to a target. Computed on demand.
 *
 * @param angularDistance shortest separation between source and target, [0, 180]
 * @param hits            every effective angle that reaches the target
 * @param primaryAngle    angle of the strongest hit, null when not aspecting
 * @param category        orb category of the primary hit; {@link OrbCategory#NONE} when not
 *                        aspecting, null for a sign-mode hit
 * @param strength        strength of the primary hit
 * @param totalStrength   sum over all hits
 * @param drishti         effect of the primary hit, null when not aspecting
 */
public record AspectResult(
    @JsonProperty("source") Body source,
    @JsonProperty("target") AspectTarget target,
    @JsonProperty("mode") AspectMode mode,
    @JsonProperty("angularDistance") double angularDistance,
    @JsonProperty("hits") List<AspectHit> hits,
    @JsonProperty("primaryAngle") Integer primaryAngle,
    @JsonProperty("category") OrbCategory category,
    @JsonProperty("strength") double strength,
    @JsonProperty("totalStrength") double totalStrength,
    @JsonProperty("drishti") DrishtiAssessment drishti
) {
    public AspectResult {
        hits = List.copyOf(hits);
    }

    public static AspectResult none(Body source, AspectTarget target, AspectMode mode, double angularDistance) {
        return new AspectResult(source, target, mode, angularDistance, List.of(), null,
            OrbCategory.NONE, 0.0, 0.0, null);
    }

    @JsonProperty("aspecting")
    public boolean aspecting() {
        return !hits.isEmpty();
    }
}
