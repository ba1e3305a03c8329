package com.vedicchart.common.angle;

/**
 * Degree arithmetic on the ecliptic circle.
 *
 * <p>Every function accepts any finite input and wraps it into range. Nothing here
 * throws for out-of-range angles; wraparound at 360° is the normal case.
 */
public final class AngleMath {

    public static final double FULL_CIRCLE = 360.0;
    public static final double HALF_CIRCLE = 180.0;

    private AngleMath() {}

    /**
     * Wraps {@code degrees} into {@code [0, 360)}.
     */
    public static double normalizeDegrees(double degrees) {
        double wrapped = degrees % FULL_CIRCLE;
        if (wrapped < 0) {
            wrapped += FULL_CIRCLE;
        }
        // -1e-15 + 360 rounds to exactly 360.0
        return wrapped >= FULL_CIRCLE ? 0.0 : wrapped;
    }

    /**
     * Shortest separation between two longitudes, in {@code [0, 180]}. Symmetric.
     */
    public static double angularDistance(double a, double b) {
        return angularDistance(a, b, false);
    }

    /**
     * @param forwardOnly when true, returns the zodiacal (counter-clockwise) arc from
     *                    {@code a} to {@code b} in {@code [0, 360)} instead of the shortest one
     */
    public static double angularDistance(double a, double b, boolean forwardOnly) {
        if (forwardOnly) {
            return normalizeDegrees(b - a);
        }
        double diff = Math.abs(normalizeDegrees(a) - normalizeDegrees(b));
        return Math.min(diff, FULL_CIRCLE - diff);
    }

    /**
     * Cyclic half-open containment: {@code start <= longitude < end}, wrapping through 0°
     * when {@code end} is numerically below {@code start}.
     */
    public static boolean isWithinArc(double longitude, double start, double end) {
        double lon = normalizeDegrees(longitude);
        double from = normalizeDegrees(start);
        double to = normalizeDegrees(end);
        if (from <= to) {
            return lon >= from && lon < to;
        }
        return lon >= from || lon < to;
    }

    /**
     * Midpoint of the forward arc from {@code start} to {@code end}.
     */
    public static double arcMidpoint(double start, double end) {
        return normalizeDegrees(start + angularDistance(start, end, true) / 2.0);
    }

    public static Dms toDms(double degrees) {
        return Dms.of(degrees);
    }

    public static double fromDms(int degrees, int minutes, double seconds) {
        double magnitude = Math.abs(degrees) + minutes / 60.0 + seconds / 3600.0;
        return degrees < 0 ? -magnitude : magnitude;
    }
}
