package com.vedicchart.common.strength;

import com.vedicchart.common.angle.AngleMath;
import com.vedicchart.common.aspect.Conjunction;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.house.HouseBuilder;
import com.vedicchart.common.house.HouseNature;
import com.vedicchart.common.model.BodyPosition;
import com.vedicchart.common.model.House;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * House-scoped yoga detection.
 *
 * <ul>
 *   <li>Kendra-Trikona: a kendra lord sits in a trikona, or a trikona lord sits in a kendra</li>
 *   <li>Parivartana: the lord of house A sits in house B and the lord of B sits in A, A ≠ B</li>
 *   <li>Conjunction: two occupants of the house within the conjunction orb</li>
 * </ul>
 *
 * <p>Each house is evaluated on its own, so an exchange is reported from both houses.
 * Lords missing from the chart produce no yoga.
 */
public final class YogaDetector {

    private YogaDetector() {}

    public static List<Yoga> detectAll(List<House> houses, Map<Body, BodyPosition> positions, double conjunctionOrb) {
        return houses.stream()
            .flatMap(h -> detect(h, houses, positions, conjunctionOrb).stream())
            .collect(Collectors.toList());
    }

    public static List<Yoga> detect(House house, List<House> houses, Map<Body, BodyPosition> positions,
                                    double conjunctionOrb) {
        List<Yoga> yogas = new ArrayList<>();
        kendraTrikona(house, houses, positions).ifPresent(yogas::add);
        parivartana(house, houses, positions).ifPresent(yogas::add);
        yogas.addAll(conjunctions(house, positions, conjunctionOrb));
        return yogas;
    }

    public static Optional<Yoga> kendraTrikona(House house, List<House> houses, Map<Body, BodyPosition> positions) {
        BodyPosition lord = positions.get(house.lord());
        if (lord == null) {
            return Optional.empty();
        }
        int n = house.number();
        int placed = HouseBuilder.houseOf(lord.longitude(), houses);
        boolean formed = (HouseNature.isKendra(n) && HouseNature.isTrikona(placed))
            || (HouseNature.isTrikona(n) && HouseNature.isKendra(placed));
        if (!formed) {
            return Optional.empty();
        }
        return Optional.of(new Yoga(YogaType.KENDRA_TRIKONA, n, List.of(n, placed), List.of(lord.body()),
            "Lord of house " + n + " (" + lord.body().displayName() + ") placed in house " + placed));
    }

    public static Optional<Yoga> parivartana(House house, List<House> houses, Map<Body, BodyPosition> positions) {
        BodyPosition lord = positions.get(house.lord());
        if (lord == null) {
            return Optional.empty();
        }
        int n = house.number();
        int placed = HouseBuilder.houseOf(lord.longitude(), houses);
        if (placed == n) {
            return Optional.empty();
        }
        BodyPosition otherLord = positions.get(HouseBuilder.house(houses, placed).lord());
        if (otherLord == null || HouseBuilder.houseOf(otherLord.longitude(), houses) != n) {
            return Optional.empty();
        }
        return Optional.of(new Yoga(YogaType.PARIVARTANA, n, List.of(n, placed),
            List.of(lord.body(), otherLord.body()),
            "Exchange between lords of houses " + n + " and " + placed
                + " (" + lord.body().displayName() + " and " + otherLord.body().displayName() + ")"));
    }

    public static List<Yoga> conjunctions(House house, Map<Body, BodyPosition> positions, double orb) {
        List<BodyPosition> occupants = house.occupants().stream()
            .map(positions::get)
            .filter(p -> p != null)
            .collect(Collectors.toList());
        List<Yoga> yogas = new ArrayList<>();
        for (int i = 0; i < occupants.size(); i++) {
            for (int j = i + 1; j < occupants.size(); j++) {
                BodyPosition a = occupants.get(i);
                BodyPosition b = occupants.get(j);
                double distance = AngleMath.angularDistance(a.longitude(), b.longitude());
                if (distance <= orb) {
                    yogas.add(new Yoga(YogaType.CONJUNCTION, house.number(), List.of(house.number()),
                        List.of(a.body(), b.body()),
                        a.body().displayName() + "-" + b.body().displayName() + " conjunction ("
                            + Conjunction.Closeness.of(distance).displayName() + ")"));
                }
            }
        }
        return yogas;
    }

    // ── chart-level ────────────────────────────────────────────────────────

    /** Every Kendra-Trikona combination in the chart. */
    public static List<Yoga> rajaYogas(List<House> houses, Map<Body, BodyPosition> positions) {
        return houses.stream()
            .map(h -> kendraTrikona(h, houses, positions))
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
    }

    /** Wealth potential from the lords of the 2nd and 11th houses, when both are in the chart. */
    public static Optional<Yoga> dhanaPotential(List<House> houses, Map<Body, BodyPosition> positions) {
        Body second = HouseBuilder.house(houses, 2).lord();
        Body eleventh = HouseBuilder.house(houses, 11).lord();
        if (!positions.containsKey(second) || !positions.containsKey(eleventh)) {
            return Optional.empty();
        }
        List<Body> bodies = second == eleventh ? List.of(second) : List.of(second, eleventh);
        return Optional.of(new Yoga(YogaType.DHANA, 2, List.of(2, 11), bodies,
            "Wealth potential from lords of houses 2 and 11 ("
                + bodies.stream().map(Body::displayName).collect(Collectors.joining(" and ")) + ")"));
    }
}
