package com.vedicchart.common.dignity;

import com.vedicchart.common.angle.AngleMath;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.catalog.NaturalRelationships;
import com.vedicchart.common.catalog.Relationship;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.position.PositionDeriver;

/**
 * Resolves dignity and natural relationships.
 *
 * <p>Dignity rules (evaluated in priority order, first match wins):
 * <ol>
 *   <li>exaltation sign → {@link Dignity#EXALTED}, or {@link Dignity#EXALTED_EXACT} within
 *       {@value #EXACT_ORB}° of the exaltation degree</li>
 *   <li>debilitation sign → {@link Dignity#DEBILITATED} / {@link Dignity#DEBILITATED_EXACT}</li>
 *   <li>owned sign → {@link Dignity#MOOLATRIKONA} inside the moolatrikona span (inclusive),
 *       else {@link Dignity#OWN_SIGN}</li>
 *   <li>otherwise → {@link Dignity#NEUTRAL}</li>
 * </ol>
 * Mercury in Virgo is both exalted and in its own sign; the order above makes it exalted.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class DignityEngine {

    public static final double EXACT_ORB = 1.0;

    private DignityEngine() {}

    public static Dignity dignity(Body body, double longitude) {
        double lon = AngleMath.normalizeDegrees(longitude);
        Sign sign = Sign.ofLongitude(lon);
        double degrees = PositionDeriver.degreesInSign(lon);

        if (body.exaltation().sign() == sign) {
            return body.exaltation().isWithin(degrees, EXACT_ORB) ? Dignity.EXALTED_EXACT : Dignity.EXALTED;
        }
        if (body.debilitation().sign() == sign) {
            return body.debilitation().isWithin(degrees, EXACT_ORB) ? Dignity.DEBILITATED_EXACT : Dignity.DEBILITATED;
        }
        if (body.owns(sign)) {
            return body.moolatrikona().contains(sign, degrees) ? Dignity.MOOLATRIKONA : Dignity.OWN_SIGN;
        }
        return Dignity.NEUTRAL;
    }

    /**
     * Natural relationship of {@code subject} towards {@code other}; directional, and
     * {@link Relationship#UNKNOWN} for unlisted pairs.
     */
    public static Relationship relationship(Body subject, Body other) {
        return NaturalRelationships.of(subject, other);
    }
}
