package com.vedicchart.common.catalog;

import com.vedicchart.common.angle.AngleMath;
import com.vedicchart.common.exception.CatalogLookupException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The twelve sidereal signs, Aries = index 0.
 *
 * <p>Sign data never references {@link Body} constants at construction time; rulers and
 * planet sets are resolved in methods so the two catalogs can refer to each other.
 */
public enum Sign {

    ARIES("Aries", "Mesha", Element.FIRE, Quality.CARDINAL),
    TAURUS("Taurus", "Vrishabha", Element.EARTH, Quality.FIXED),
    GEMINI("Gemini", "Mithuna", Element.AIR, Quality.MUTABLE),
    CANCER("Cancer", "Karkat", Element.WATER, Quality.CARDINAL),
    LEO("Leo", "Simha", Element.FIRE, Quality.FIXED),
    VIRGO("Virgo", "Kanya", Element.EARTH, Quality.MUTABLE),
    LIBRA("Libra", "Tula", Element.AIR, Quality.CARDINAL),
    SCORPIO("Scorpio", "Vrischik", Element.WATER, Quality.FIXED),
    SAGITTARIUS("Sagittarius", "Dhanu", Element.FIRE, Quality.MUTABLE),
    CAPRICORN("Capricorn", "Makar", Element.EARTH, Quality.CARDINAL),
    AQUARIUS("Aquarius", "Kumbha", Element.AIR, Quality.FIXED),
    PISCES("Pisces", "Meen", Element.WATER, Quality.MUTABLE);

    public static final double SPAN = 30.0;
    public static final int COUNT = 12;

    private final String displayName;
    private final String sanskritName;
    private final Element element;
    private final Quality quality;

    Sign(String displayName, String sanskritName, Element element, Quality quality) {
        this.displayName = displayName;
        this.sanskritName = sanskritName;
        this.element = element;
        this.quality = quality;
    }

    public String displayName()  { return displayName; }
    public String sanskritName() { return sanskritName; }
    public Element element()     { return element; }
    public Quality quality()     { return quality; }

    public int index() {
        return ordinal();
    }

    /** 1-based sign number, Aries = 1. */
    public int number() {
        return ordinal() + 1;
    }

    public double startLongitude() {
        return ordinal() * SPAN;
    }

    /** Odd in the traditional 1-based count: Aries, Gemini, Leo... */
    public boolean isOddSign() {
        return ordinal() % 2 == 0;
    }

    // ── lookups ────────────────────────────────────────────────────────────

    /** Any integer, wrapped mod 12. */
    public static Sign ofIndex(int index) {
        return values()[Math.floorMod(index, COUNT)];
    }

    public static Sign ofLongitude(double longitude) {
        int index = (int) Math.floor(AngleMath.normalizeDegrees(longitude) / SPAN);
        return values()[Math.min(index, COUNT - 1)];
    }

    /**
     * Resolves an English or Sanskrit sign name, ignoring case.
     *
     * @throws CatalogLookupException when the name matches no sign
     */
    public static Sign fromName(String name) {
        if (name != null) {
            String key = name.trim().toUpperCase(Locale.ROOT);
            for (Sign sign : values()) {
                if (sign.name().equals(key)
                        || sign.sanskritName.toUpperCase(Locale.ROOT).equals(key)) {
                    return sign;
                }
            }
        }
        throw new CatalogLookupException("Sign", name);
    }

    // ── relations between signs ────────────────────────────────────────────

    public Sign offset(int signs) {
        return ofIndex(ordinal() + signs);
    }

    /** The 7th sign from this one. */
    public Sign opposite() {
        return offset(6);
    }

    /**
     * Signs stepped forward from this sign to {@code other}, in 1..12; the sign itself gives 12.
     */
    public int countTo(Sign other) {
        int distance = other.ordinal() - ordinal();
        return distance <= 0 ? distance + COUNT : distance;
    }

    /** This sign, the 5th and the 9th. */
    public List<Sign> trikonaSigns() {
        return List.of(this, offset(4), offset(8));
    }

    /** This sign, the 4th, the 7th and the 10th. */
    public List<Sign> kendraSigns() {
        return List.of(this, offset(3), offset(6), offset(9));
    }

    /**
     * Signs aspected by this sign: always the 7th, plus every sign of the modality this
     * one aspects (movable → fixed, fixed → dual, dual → movable) except the two signs
     * adjacent to this one. Never includes this sign. Ordered from Aries.
     */
    public List<Sign> rasiAspects() {
        List<Sign> aspected = new ArrayList<>();
        Quality target = quality.aspectedQuality();
        Sign opposite = opposite();
        for (Sign candidate : values()) {
            if (candidate == this) {
                continue;
            }
            int steps = countTo(candidate);
            boolean adjacent = steps == 1 || steps == COUNT - 1;
            boolean byModality = candidate.quality == target && !adjacent;
            if (candidate == opposite || byModality) {
                aspected.add(candidate);
            }
        }
        return aspected;
    }

    public boolean aspectsSign(Sign other) {
        return rasiAspects().contains(other);
    }

    // ── planetary associations ─────────────────────────────────────────────

    public Body ruler() {
        return switch (this) {
            case ARIES, SCORPIO       -> Body.MARS;
            case TAURUS, LIBRA        -> Body.VENUS;
            case GEMINI, VIRGO        -> Body.MERCURY;
            case CANCER               -> Body.MOON;
            case LEO                  -> Body.SUN;
            case SAGITTARIUS, PISCES  -> Body.JUPITER;
            case CAPRICORN, AQUARIUS  -> Body.SATURN;
        };
    }

    public Optional<Body> exaltationBody() {
        return Optional.ofNullable(switch (this) {
            case ARIES       -> Body.SUN;
            case TAURUS      -> Body.MOON;
            case GEMINI      -> Body.RAHU;
            case CANCER      -> Body.JUPITER;
            case VIRGO       -> Body.MERCURY;
            case LIBRA       -> Body.SATURN;
            case SCORPIO, SAGITTARIUS -> Body.KETU;
            case CAPRICORN   -> Body.MARS;
            case PISCES      -> Body.VENUS;
            case LEO, AQUARIUS -> null;
        });
    }

    public Optional<Body> debilitationBody() {
        return Optional.ofNullable(switch (this) {
            case ARIES       -> Body.SATURN;
            case GEMINI      -> Body.KETU;
            case CANCER      -> Body.MARS;
            case VIRGO       -> Body.VENUS;
            case LIBRA       -> Body.SUN;
            case SCORPIO     -> Body.MOON;
            case SAGITTARIUS -> Body.RAHU;
            case CAPRICORN   -> Body.JUPITER;
            case PISCES      -> Body.MERCURY;
            case TAURUS, LEO, AQUARIUS -> null;
        });
    }

    public List<Body> friendlyBodies() {
        return switch (this) {
            case GEMINI, VIRGO -> List.of(Body.SUN, Body.MERCURY, Body.VENUS);
            case TAURUS, LIBRA, CAPRICORN, AQUARIUS -> List.of(Body.MERCURY, Body.VENUS, Body.SATURN);
            default -> List.of(Body.SUN, Body.MOON, Body.MARS, Body.JUPITER);
        };
    }

    public List<Body> enemyBodies() {
        return switch (this) {
            case GEMINI, VIRGO -> List.of(Body.MOON, Body.MARS, Body.JUPITER);
            case TAURUS, LIBRA, CAPRICORN, AQUARIUS -> List.of(Body.SUN, Body.MOON, Body.MARS);
            default -> List.of(Body.MERCURY, Body.VENUS, Body.SATURN);
        };
    }
}
