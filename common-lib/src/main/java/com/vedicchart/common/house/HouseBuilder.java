package com.vedicchart.common.house;

import com.vedicchart.common.angle.AngleMath;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.model.BodyPosition;
import com.vedicchart.common.model.House;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the twelve houses from the ascendant and places bodies into them.
 *
 * <p>Placement is a cyclic half-open test against {@code [cusp(i), cusp(i+1))}. The sandhi
 * (junction) flag marks longitudes within {@value #SANDHI_ORB}° of any cusp; it never
 * changes placement.
 */
public final class HouseBuilder {

    public static final double SANDHI_ORB = 2.0;

    private HouseBuilder() {}

    public static List<House> build(double ascendant, Collection<BodyPosition> positions) {
        return build(ascendant, positions, EqualHouseSystem.INSTANCE);
    }

    public static List<House> build(double ascendant, Collection<BodyPosition> positions, HouseSystem system) {
        List<Double> cusps = system.cusps(ascendant);
        List<House> houses = new ArrayList<>(12);
        for (int i = 0; i < 12; i++) {
            double cusp = cusps.get(i);
            double next = cusps.get((i + 1) % 12);
            Sign sign = Sign.ofLongitude(cusp);
            List<Body> occupants = positions.stream()
                .filter(p -> AngleMath.isWithinArc(p.longitude(), cusp, next))
                .map(BodyPosition::body)
                .sorted(Comparator.comparingInt(Body::ordinal))
                .collect(Collectors.toList());
            houses.add(new House(i + 1, cusp, next, sign, sign.ruler(), occupants));
        }
        return Collections.unmodifiableList(houses);
    }

    /** Equal-house placement: ⌊((lon − asc) mod 360) / 30⌋ + 1. */
    public static int houseOf(double longitude, double ascendant) {
        double fromAscendant = AngleMath.normalizeDegrees(longitude - ascendant);
        return Math.min((int) Math.floor(fromAscendant / 30.0), 11) + 1;
    }

    public static int houseOf(double longitude, List<House> houses) {
        for (House house : houses) {
            if (house.contains(longitude)) {
                return house.number();
            }
        }
        // cusps cover the full circle, so only a malformed house list lands here
        throw new IllegalStateException("No house contains longitude " + longitude);
    }

    /** Within {@value #SANDHI_ORB}° (inclusive) of any cusp. */
    public static boolean isInSandhi(double longitude, List<House> houses) {
        return houses.stream()
            .anyMatch(h -> AngleMath.angularDistance(longitude, h.cusp()) <= SANDHI_ORB);
    }

    public static boolean isInSandhi(double longitude, double ascendant) {
        return EqualHouseSystem.INSTANCE.cusps(ascendant).stream()
            .anyMatch(cusp -> AngleMath.angularDistance(longitude, cusp) <= SANDHI_ORB);
    }

    public static House house(List<House> houses, int number) {
        return houses.get(HouseNature.requireValid(number) - 1);
    }
}
