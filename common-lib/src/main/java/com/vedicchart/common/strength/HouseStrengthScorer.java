package com.vedicchart.common.strength;

import com.vedicchart.common.aspect.AspectMatrix;
import com.vedicchart.common.aspect.AspectResult;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.catalog.Nature;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.dignity.Dignity;
import com.vedicchart.common.dignity.DignityEngine;
import com.vedicchart.common.house.HouseBuilder;
import com.vedicchart.common.house.HouseNature;
import com.vedicchart.common.model.BodyPosition;
import com.vedicchart.common.model.House;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Composite house strength: Σ weight × factor over five factors.
 *
 * <ul>
 *   <li>base (0.2): 1.0 kendra and trikona, 0.8 either, 0.6 upachaya, 0.2 dusthana, else 0.5</li>
 *   <li>lord (0.3): 0.5 ± dignity (+0.4 exalted, +0.3 own/moolatrikona, −0.3 debilitated),
 *       +0.2 placed in a kendra or trikona / −0.2 in a dusthana, −0.1 retrograde; clamped.
 *       A lord missing from the chart scores 0.0</li>
 *   <li>occupant (0.25): mean of per-occupant scores (same dignity deltas, +0.1 benefic,
 *       −0.05 malefic, −0.1 retrograde, each clamped); empty house 0.3</li>
 *   <li>aspect (0.15): mean of incoming total strengths weighted ×1.2 benefic, ×0.8 malefic,
 *       ×1.0 neutral, capped at 1.0; no aspects 0.3</li>
 *   <li>sign (0.1): mean of the element and quality constants of the house sign</li>
 * </ul>
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class HouseStrengthScorer {

    public static final double BASE_WEIGHT = 0.2;
    public static final double LORD_WEIGHT = 0.3;
    public static final double OCCUPANT_WEIGHT = 0.25;
    public static final double ASPECT_WEIGHT = 0.15;
    public static final double SIGN_WEIGHT = 0.1;

    /** Empty house, and house with no incoming aspects. */
    public static final double NEUTRAL_FACTOR = 0.3;

    public static final double STRONG_CONTRIBUTOR = 0.7;
    public static final double WEAK_CONTRIBUTOR = 0.3;

    private HouseStrengthScorer() {}

    public static List<HouseStrength> scoreAll(List<House> houses, Map<Body, BodyPosition> positions,
                                               AspectMatrix aspects) {
        return houses.stream()
            .map(h -> score(h, houses, positions, aspects))
            .collect(Collectors.toList());
    }

    public static HouseStrength score(House house, List<House> houses, Map<Body, BodyPosition> positions,
                                      AspectMatrix aspects) {
        double base = baseFactor(house.number());
        double lord = lordFactor(house, houses, positions);
        double occupant = occupantFactor(house, positions);
        double aspect = aspectFactor(aspects.aspectsToHouse(house.number()));
        double sign = signFactor(house.sign());

        double total = clamp(BASE_WEIGHT * base
            + LORD_WEIGHT * lord
            + OCCUPANT_WEIGHT * occupant
            + ASPECT_WEIGHT * aspect
            + SIGN_WEIGHT * sign);

        List<String> contributors = new ArrayList<>();
        addContributor(contributors, "base", base);
        addContributor(contributors, "lord", lord);
        addContributor(contributors, "occupant", occupant);
        addContributor(contributors, "aspect", aspect);
        addContributor(contributors, "sign", sign);

        return new HouseStrength(house.number(), base, lord, occupant, aspect, sign, total,
            StrengthCategory.of(total), List.copyOf(contributors));
    }

    // ── factors ────────────────────────────────────────────────────────────

    public static double baseFactor(int house) {
        boolean kendra = HouseNature.isKendra(house);
        boolean trikona = HouseNature.isTrikona(house);
        if (kendra && trikona) return 1.0;
        if (kendra || trikona) return 0.8;
        if (HouseNature.isUpachaya(house)) return 0.6;
        if (HouseNature.isDusthana(house)) return 0.2;
        return 0.5;
    }

    public static double lordFactor(House house, List<House> houses, Map<Body, BodyPosition> positions) {
        BodyPosition lord = positions.get(house.lord());
        if (lord == null) {
            return 0.0;
        }
        double score = 0.5 + dignityDelta(DignityEngine.dignity(lord.body(), lord.longitude()));

        int placed = HouseBuilder.houseOf(lord.longitude(), houses);
        if (HouseNature.isKendra(placed) || HouseNature.isTrikona(placed)) {
            score += 0.2;
        } else if (HouseNature.isDusthana(placed)) {
            score -= 0.2;
        }
        if (lord.retrograde()) {
            score -= 0.1;
        }
        return clamp(score);
    }

    public static double occupantFactor(House house, Map<Body, BodyPosition> positions) {
        List<BodyPosition> occupants = house.occupants().stream()
            .map(positions::get)
            .filter(p -> p != null)
            .collect(Collectors.toList());
        if (occupants.isEmpty()) {
            return NEUTRAL_FACTOR;
        }
        double sum = 0.0;
        for (BodyPosition occupant : occupants) {
            double score = 0.5 + dignityDelta(DignityEngine.dignity(occupant.body(), occupant.longitude()));
            if (occupant.body().nature() == Nature.BENEFIC) {
                score += 0.1;
            } else if (occupant.body().nature() == Nature.MALEFIC) {
                score -= 0.05;
            }
            if (occupant.retrograde()) {
                score -= 0.1;
            }
            sum += clamp(score);
        }
        return sum / occupants.size();
    }

    /**
     * @param incoming aspecting results on the house; non-aspecting entries are ignored
     */
    public static double aspectFactor(List<AspectResult> incoming) {
        double sum = 0.0;
        int count = 0;
        for (AspectResult result : incoming) {
            if (!result.aspecting()) {
                continue;
            }
            sum += result.totalStrength() * natureWeight(result.source().nature());
            count++;
        }
        if (count == 0) {
            return NEUTRAL_FACTOR;
        }
        return Math.min(1.0, sum / count);
    }

    public static double signFactor(Sign sign) {
        double element = switch (sign.element()) {
            case FIRE  -> 0.7;
            case EARTH -> 0.6;
            case AIR   -> 0.5;
            case WATER -> 0.6;
        };
        double quality = switch (sign.quality()) {
            case CARDINAL -> 0.7;
            case FIXED    -> 0.8;
            case MUTABLE  -> 0.5;
        };
        return (element + quality) / 2.0;
    }

    // ── rankings ───────────────────────────────────────────────────────────

    /** Highest totals first; lower house number first on equal totals. */
    public static List<HouseStrength> strongest(List<HouseStrength> strengths, int count) {
        return strengths.stream()
            .sorted(Comparator.comparingDouble(HouseStrength::total).reversed()
                .thenComparingInt(HouseStrength::house))
            .limit(count)
            .collect(Collectors.toList());
    }

    /** Lowest totals first; lower house number first on equal totals. */
    public static List<HouseStrength> weakest(List<HouseStrength> strengths, int count) {
        return strengths.stream()
            .sorted(Comparator.comparingDouble(HouseStrength::total)
                .thenComparingInt(HouseStrength::house))
            .limit(count)
            .collect(Collectors.toList());
    }

    /**
     * Houses counted from {@code house} to where its lord sits (1..12, the house itself
     * counting as 12); empty when the lord is not in the chart.
     */
    public static OptionalInt lordDistance(House house, List<House> houses, Map<Body, BodyPosition> positions) {
        return lordPlacement(house, houses, positions)
            .map(placed -> OptionalInt.of(HouseNature.countFrom(house.number(), placed)))
            .orElse(OptionalInt.empty());
    }

    /** House number the lord of {@code house} occupies, if the lord is in the chart. */
    public static Optional<Integer> lordPlacement(House house, List<House> houses, Map<Body, BodyPosition> positions) {
        return Optional.ofNullable(positions.get(house.lord()))
            .map(lord -> HouseBuilder.houseOf(lord.longitude(), houses));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static double dignityDelta(Dignity dignity) {
        if (dignity.isExalted()) return 0.4;
        if (dignity.isOwnOrMoolatrikona()) return 0.3;
        if (dignity.isDebilitated()) return -0.3;
        return 0.0;
    }

    static double natureWeight(Nature nature) {
        return switch (nature) {
            case BENEFIC -> 1.2;
            case MALEFIC -> 0.8;
            case NEUTRAL -> 1.0;
        };
    }

    private static void addContributor(List<String> contributors, String factor, double value) {
        if (value >= STRONG_CONTRIBUTOR) {
            contributors.add("Strong " + factor);
        } else if (value <= WEAK_CONTRIBUTOR) {
            contributors.add("Weak " + factor);
        }
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
