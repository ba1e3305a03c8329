package com.vedicchart.common.aspect;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Influence tally of the aspects landing on one target.
 */
public record DrishtiSummary(
    @JsonProperty("totalAspects") int totalAspects,
    @JsonProperty("beneficAspects") int beneficAspects,
    @JsonProperty("maleficAspects") int maleficAspects,
    @JsonProperty("neutralAspects") int neutralAspects,
    @JsonProperty("strongestAspect") AspectResult strongestAspect,
    @JsonProperty("overallInfluence") String overallInfluence
) {
    public static final String NO_MAJOR_ASPECTS = "No major aspects";
    public static final String PREDOMINANTLY_AUSPICIOUS = "Predominantly Auspicious";
    public static final String PREDOMINANTLY_INAUSPICIOUS = "Predominantly Inauspicious";
    public static final String MIXED = "Mixed Influences";

    /**
     * @param aspects aspecting results on a single target
     */
    public static DrishtiSummary of(List<AspectResult> aspects) {
        List<AspectResult> landed = aspects.stream()
            .filter(AspectResult::aspecting)
            .collect(Collectors.toList());
        if (landed.isEmpty()) {
            return new DrishtiSummary(0, 0, 0, 0, null, NO_MAJOR_ASPECTS);
        }
        int benefic = count(landed, DrishtiEffect.Polarity.AUSPICIOUS);
        int malefic = count(landed, DrishtiEffect.Polarity.INAUSPICIOUS);
        int neutral = count(landed, DrishtiEffect.Polarity.NEUTRAL);

        AspectResult strongest = landed.stream()
            .max(Comparator.comparingDouble(AspectResult::strength))
            .orElse(null);

        String overall;
        if (benefic > malefic) {
            overall = PREDOMINANTLY_AUSPICIOUS;
        } else if (malefic > benefic) {
            overall = PREDOMINANTLY_INAUSPICIOUS;
        } else {
            overall = MIXED;
        }
        return new DrishtiSummary(landed.size(), benefic, malefic, neutral, strongest, overall);
    }

    private static int count(List<AspectResult> aspects, DrishtiEffect.Polarity polarity) {
        return (int) aspects.stream()
            .filter(a -> a.drishti().effect().polarity() == polarity)
            .count();
    }
}
