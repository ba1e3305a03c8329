package com.vedicchart.common.catalog;

import com.vedicchart.common.angle.AngleMath;
import com.vedicchart.common.exception.CatalogLookupException;

import java.util.Locale;

/**
 * The 27 lunar mansions, each 13°20′ wide, starting at 0° Aries.
 */
public enum Nakshatra {

    ASHWINI("Ashwini"),
    BHARANI("Bharani"),
    KRITTIKA("Krittika"),
    ROHINI("Rohini"),
    MRIGASHIRA("Mrigashira"),
    ARDRA("Ardra"),
    PUNARVASU("Punarvasu"),
    PUSHYA("Pushya"),
    ASHLESHA("Ashlesha"),
    MAGHA("Magha"),
    PURVA_PHALGUNI("Purva Phalguni"),
    UTTARA_PHALGUNI("Uttara Phalguni"),
    HASTA("Hasta"),
    CHITRA("Chitra"),
    SWATI("Swati"),
    VISHAKHA("Vishakha"),
    ANURADHA("Anuradha"),
    JYESHTHA("Jyeshtha"),
    MULA("Mula"),
    PURVA_ASHADHA("Purva Ashadha"),
    UTTARA_ASHADHA("Uttara Ashadha"),
    SHRAVANA("Shravana"),
    DHANISHTA("Dhanishta"),
    SHATABHISHA("Shatabhisha"),
    PURVA_BHADRAPADA("Purva Bhadrapada"),
    UTTARA_BHADRAPADA("Uttara Bhadrapada"),
    REVATI("Revati");

    public static final int COUNT = 27;
    public static final double SPAN = AngleMath.FULL_CIRCLE / COUNT;
    public static final double PADA_SPAN = SPAN / 4.0;

    /** Vimshottari dasha order; lordship repeats every nine mansions. */
    private static final Body[] LORD_CYCLE = {
        Body.KETU, Body.VENUS, Body.SUN, Body.MOON, Body.MARS,
        Body.RAHU, Body.JUPITER, Body.SATURN, Body.MERCURY
    };

    private final String displayName;

    Nakshatra(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public Body lord() {
        return LORD_CYCLE[ordinal() % LORD_CYCLE.length];
    }

    public double startLongitude() {
        return ordinal() * SPAN;
    }

    public static Nakshatra ofIndex(int index) {
        return values()[Math.floorMod(index, COUNT)];
    }

    public static Nakshatra ofLongitude(double longitude) {
        int index = (int) Math.floor(AngleMath.normalizeDegrees(longitude) / SPAN);
        return values()[Math.min(index, COUNT - 1)];
    }

    /**
     * @throws CatalogLookupException when the name matches no mansion
     */
    public static Nakshatra fromName(String name) {
        if (name != null) {
            String key = name.trim().toUpperCase(Locale.ROOT).replace(' ', '_');
            for (Nakshatra n : values()) {
                if (n.name().equals(key)) {
                    return n;
                }
            }
        }
        throw new CatalogLookupException("Nakshatra", name);
    }
}
