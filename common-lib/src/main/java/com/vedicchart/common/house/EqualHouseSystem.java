package com.vedicchart.common.house;

import com.vedicchart.common.angle.AngleMath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * cusp(i) = ascendant + (i − 1) × 30.
 */
public final class EqualHouseSystem implements HouseSystem {

    public static final EqualHouseSystem INSTANCE = new EqualHouseSystem();

    private EqualHouseSystem() {}

    @Override
    public List<Double> cusps(double ascendant) {
        List<Double> cusps = new ArrayList<>(12);
        for (int i = 0; i < 12; i++) {
            cusps.add(AngleMath.normalizeDegrees(ascendant + i * 30.0));
        }
        return Collections.unmodifiableList(cusps);
    }

    @Override
    public String name() {
        return "Equal";
    }
}
