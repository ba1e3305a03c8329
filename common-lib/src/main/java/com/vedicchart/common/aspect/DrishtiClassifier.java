package com.vedicchart.common.aspect;

import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.catalog.Nature;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.dignity.Dignity;
import com.vedicchart.common.dignity.DignityEngine;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Drishti-effect lookup keyed by (aspecting body's nature, dignity tier at the aspected
 * position).
 *
 * <pre>
 *               Dignified        Friend               Neutral             Enemy              Debilitated
 *   Benefic     Very Auspicious  Auspicious           Mildly Auspicious   Neutral            Neutral
 *   Malefic     Neutral          Mildly Inauspicious  Inauspicious        Very Inauspicious  Extremely Inauspicious
 * </pre>
 * Neutral-natured bodies (Mercury) always give {@link DrishtiEffect#NEUTRAL}.
 */
public final class DrishtiClassifier {

    private static final Map<Nature, Map<DrishtiTier, DrishtiEffect>> TABLE = new EnumMap<>(Nature.class);

    static {
        Map<DrishtiTier, DrishtiEffect> benefic = new EnumMap<>(DrishtiTier.class);
        benefic.put(DrishtiTier.DIGNIFIED, DrishtiEffect.VERY_AUSPICIOUS);
        benefic.put(DrishtiTier.FRIEND, DrishtiEffect.AUSPICIOUS);
        benefic.put(DrishtiTier.NEUTRAL, DrishtiEffect.MILDLY_AUSPICIOUS);
        benefic.put(DrishtiTier.ENEMY, DrishtiEffect.NEUTRAL);
        benefic.put(DrishtiTier.DEBILITATED, DrishtiEffect.NEUTRAL);

        Map<DrishtiTier, DrishtiEffect> malefic = new EnumMap<>(DrishtiTier.class);
        malefic.put(DrishtiTier.DIGNIFIED, DrishtiEffect.NEUTRAL);
        malefic.put(DrishtiTier.FRIEND, DrishtiEffect.MILDLY_INAUSPICIOUS);
        malefic.put(DrishtiTier.NEUTRAL, DrishtiEffect.INAUSPICIOUS);
        malefic.put(DrishtiTier.ENEMY, DrishtiEffect.VERY_INAUSPICIOUS);
        malefic.put(DrishtiTier.DEBILITATED, DrishtiEffect.EXTREMELY_INAUSPICIOUS);

        TABLE.put(Nature.BENEFIC, Collections.unmodifiableMap(benefic));
        TABLE.put(Nature.MALEFIC, Collections.unmodifiableMap(malefic));
    }

    /** Degree-mode strength at or above this reads "Strong". */
    public static final double STRONG_THRESHOLD = 0.75;
    /** Degree-mode strength at or above this (and below strong) reads "Moderate". */
    public static final double MODERATE_THRESHOLD = 0.5;

    private DrishtiClassifier() {}

    public static DrishtiEffect classify(Nature nature, DrishtiTier tier) {
        Map<DrishtiTier, DrishtiEffect> row = TABLE.get(nature);
        return row == null ? DrishtiEffect.NEUTRAL : row.get(tier);
    }

    public static String strengthQualifier(double strength) {
        if (strength >= STRONG_THRESHOLD) {
            return "Strong";
        }
        if (strength >= MODERATE_THRESHOLD) {
            return "Moderate";
        }
        return "Weak";
    }

    /**
     * Full assessment of {@code body} aspecting a point at {@code aspectLongitude}.
     *
     * @param aspectLongitude where dignity is evaluated: the aspected sign's midpoint in
     *                        sign mode, source longitude + angle in degree mode
     * @param strength        strength of the primary hit; only used in degree mode
     */
    public static DrishtiAssessment assess(Body body, double aspectLongitude, AspectMode mode, double strength) {
        Sign aspectedSign = Sign.ofLongitude(aspectLongitude);
        Dignity dignity = DignityEngine.dignity(body, aspectLongitude);
        DrishtiTier tier = DrishtiTier.of(dignity);
        DrishtiEffect effect = classify(body.nature(), tier);

        if (mode == AspectMode.RASI) {
            return new DrishtiAssessment(aspectedSign, dignity, tier, body.nature(), effect,
                null, effect.displayName());
        }
        String qualifier = strengthQualifier(strength);
        return new DrishtiAssessment(aspectedSign, dignity, tier, body.nature(), effect,
            qualifier, qualifier + " " + effect.displayName());
    }
}
