package com.vedicchart.common.position;

import com.vedicchart.common.angle.AngleMath;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.catalog.Nakshatra;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.model.BodyPosition;

/**
 * Derives zodiacal placement from a sidereal longitude.
 *
 * <ul>
 *   <li>sign index = ⌊lon / 30⌋</li>
 *   <li>degrees in sign = lon mod 30</li>
 *   <li>nakshatra index = ⌊lon / (360/27)⌋</li>
 *   <li>pada = ⌊(lon mod 13°20′) / 3°20′⌋ + 1</li>
 * </ul>
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class PositionDeriver {

    private PositionDeriver() {}

    public static BodyPosition derive(Body body, double siderealLongitude, double latitude, double speed) {
        double lon = AngleMath.normalizeDegrees(siderealLongitude);
        return new BodyPosition(body, lon, latitude, speed,
            signOf(lon), degreesInSign(lon), nakshatraOf(lon), padaOf(lon));
    }

    public static Sign signOf(double longitude) {
        return Sign.ofLongitude(longitude);
    }

    public static double degreesInSign(double longitude) {
        return AngleMath.normalizeDegrees(longitude) % Sign.SPAN;
    }

    public static Nakshatra nakshatraOf(double longitude) {
        return Nakshatra.ofLongitude(longitude);
    }

    /** Quarter of the nakshatra, 1..4. */
    public static int padaOf(double longitude) {
        double intoMansion = AngleMath.normalizeDegrees(longitude) % Nakshatra.SPAN;
        int pada = (int) Math.floor(intoMansion / Nakshatra.PADA_SPAN) + 1;
        return Math.min(pada, 4);
    }

    /** Degrees already travelled through the current nakshatra. */
    public static double degreesInNakshatra(double longitude) {
        return AngleMath.normalizeDegrees(longitude) % Nakshatra.SPAN;
    }
}
