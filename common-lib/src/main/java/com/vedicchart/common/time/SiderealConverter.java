package com.vedicchart.common.time;

import com.vedicchart.common.angle.AngleMath;

/**
 * Tropical ↔ sidereal longitude conversion. Results are always normalized to [0, 360).
 */
public final class SiderealConverter {

    private SiderealConverter() {}

    public static double tropicalToSidereal(double tropicalLongitude, double julianDay, AyanamsaSystem system) {
        return AngleMath.normalizeDegrees(tropicalLongitude - system.valueAt(julianDay));
    }

    public static double siderealToTropical(double siderealLongitude, double julianDay, AyanamsaSystem system) {
        return AngleMath.normalizeDegrees(siderealLongitude + system.valueAt(julianDay));
    }

    /**
     * Approximate sidereal ascendant from local sidereal time, used only when no ephemeris
     * ascendant is available: {@code tropicalToSidereal((LST + latitude × 0.5) mod 360)}.
     */
    public static double fallbackAscendant(double julianDay, double latitude, double longitude,
                                           AyanamsaSystem system) {
        double lst = SiderealTime.localSiderealTime(julianDay, longitude);
        return tropicalToSidereal(AngleMath.normalizeDegrees(lst + latitude * 0.5), julianDay, system);
    }
}
