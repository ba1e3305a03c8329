package com.vedicchart.common.time;

import com.vedicchart.common.angle.AngleMath;

/**
 * Mean sidereal time in degrees, from the IAU 1982 polynomial.
 */
public final class SiderealTime {

    private SiderealTime() {}

    public static double greenwichMeanSiderealTime(double julianDay) {
        double daysSinceEpoch = julianDay - JulianDay.J2000;
        double t = JulianDay.centuriesSinceJ2000(julianDay);
        double gmst = 280.46061837
            + 360.98564736629 * daysSinceEpoch
            + 0.000387933 * t * t
            - t * t * t / 38710000.0;
        return AngleMath.normalizeDegrees(gmst);
    }

    /**
     * @param geographicLongitude east-positive degrees
     */
    public static double localSiderealTime(double julianDay, double geographicLongitude) {
        return AngleMath.normalizeDegrees(greenwichMeanSiderealTime(julianDay) + geographicLongitude);
    }
}
