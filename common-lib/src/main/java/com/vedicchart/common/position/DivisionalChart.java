package com.vedicchart.common.position;

import com.vedicchart.common.angle.AngleMath;
import com.vedicchart.common.catalog.Sign;

/**
 * Divisional (varga) charts. Each division is a pure function {@code longitude → sign}.
 *
 * <ul>
 *   <li>D1 rasi: the sign itself</li>
 *   <li>D2 hora: halves of 15°. First half of an even-index sign (Aries, Gemini...) → Cancer,
 *       second half → Leo; odd-index signs the other way round</li>
 *   <li>D3 drekkana: thirds of 10° → the sign, its 5th, its 9th</li>
 *   <li>D9 navamsa: ninths of 3°20′ counted from Aries (fire), Capricorn (earth),
 *       Libra (air) or Cancer (water)</li>
 *   <li>D10 dasamsa: tenths of 3° counted from the sign (odd signs) or its 9th (even signs)</li>
 *   <li>D12 dwadasamsa: twelfths of 2°30′ counted from the sign</li>
 * </ul>
 */
public enum DivisionalChart {

    D1(1, "Rasi"),
    D2(2, "Hora"),
    D3(3, "Drekkana"),
    D9(9, "Navamsa"),
    D10(10, "Dasamsa"),
    D12(12, "Dwadasamsa");

    private final int divisions;
    private final String displayName;

    DivisionalChart(int divisions, String displayName) {
        this.divisions = divisions;
        this.displayName = displayName;
    }

    public int divisions() {
        return divisions;
    }

    public String displayName() {
        return displayName;
    }

    /** Width of one part of a sign in this division. */
    public double partSpan() {
        return Sign.SPAN / divisions;
    }

    public Sign signOf(double longitude) {
        double lon = AngleMath.normalizeDegrees(longitude);
        Sign sign = Sign.ofLongitude(lon);
        int part = partIndex(PositionDeriver.degreesInSign(lon));

        return switch (this) {
            case D1  -> sign;
            case D2  -> hora(sign, part);
            case D3  -> sign.offset(part * 4);
            case D9  -> navamsaStart(sign).offset(part);
            case D10 -> (sign.isOddSign() ? sign : sign.offset(8)).offset(part);
            case D12 -> sign.offset(part);
        };
    }

    private int partIndex(double degreesInSign) {
        int part = (int) Math.floor(degreesInSign / partSpan());
        return Math.min(part, divisions - 1);
    }

    private static Sign hora(Sign sign, int half) {
        boolean evenIndex = sign.index() % 2 == 0;
        if (half == 0) {
            return evenIndex ? Sign.CANCER : Sign.LEO;
        }
        return evenIndex ? Sign.LEO : Sign.CANCER;
    }

    private static Sign navamsaStart(Sign sign) {
        return switch (sign.element()) {
            case FIRE  -> Sign.ARIES;
            case EARTH -> Sign.CAPRICORN;
            case AIR   -> Sign.LIBRA;
            case WATER -> Sign.CANCER;
        };
    }
}
