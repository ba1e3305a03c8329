package com.vedicchart.common.time;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Gregorian-calendar Julian Day conversion.
 *
 * <p>Inputs are UTC. Timezone resolution belongs to the caller; this class never
 * consults a zone database.
 */
public final class JulianDay {

    /** Julian Day of 2000-01-01T12:00 UTC. */
    public static final double J2000 = 2451545.0;

    public static final double DAYS_PER_JULIAN_YEAR = 365.25;
    public static final double DAYS_PER_JULIAN_CENTURY = 36525.0;

    private static final long MILLIS_PER_DAY = 86_400_000L;

    private JulianDay() {}

    public static double of(Instant instant) {
        return of(LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    /**
     * @param utc a wall-clock time already expressed in UTC
     */
    public static double of(LocalDateTime utc) {
        int year = utc.getYear();
        int month = utc.getMonthValue();
        double hours = utc.getHour()
            + utc.getMinute() / 60.0
            + (utc.getSecond() + utc.getNano() / 1_000_000_000.0) / 3600.0;

        // January and February count as months 13 and 14 of the previous year
        if (month <= 2) {
            year -= 1;
            month += 12;
        }
        int a = Math.floorDiv(year, 100);
        int b = 2 - a + Math.floorDiv(a, 4);

        return Math.floor(DAYS_PER_JULIAN_YEAR * (year + 4716))
            + Math.floor(30.6001 * (month + 1))
            + utc.getDayOfMonth() + b - 1524.5
            + hours / 24.0;
    }

    /**
     * Inverse of {@link #of(LocalDateTime)}, rounded to the millisecond.
     */
    public static LocalDateTime toDateTime(double julianDay) {
        double shifted = julianDay + 0.5;
        long z = (long) Math.floor(shifted);
        double fraction = shifted - z;

        long a;
        if (z < 2299161L) {
            a = z;
        } else {
            long alpha = (long) Math.floor((z - 1867216.25) / 36524.25);
            a = z + 1 + alpha - Math.floorDiv(alpha, 4);
        }
        long b = a + 1524;
        long c = (long) Math.floor((b - 122.1) / DAYS_PER_JULIAN_YEAR);
        long d = (long) Math.floor(DAYS_PER_JULIAN_YEAR * c);
        long e = (long) Math.floor((b - d) / 30.6001);

        int day = (int) (b - d - (long) Math.floor(30.6001 * e));
        int month = (int) (e < 14 ? e - 1 : e - 13);
        int year = (int) (month > 2 ? c - 4716 : c - 4715);

        long millis = Math.round(fraction * MILLIS_PER_DAY);
        return LocalDateTime.of(year, month, day, 0, 0).plusNanos(millis * 1_000_000L);
    }

    /** Julian years elapsed since J2000; negative before it. */
    public static double yearsSinceJ2000(double julianDay) {
        return (julianDay - J2000) / DAYS_PER_JULIAN_YEAR;
    }

    /** Julian centuries elapsed since J2000. */
    public static double centuriesSinceJ2000(double julianDay) {
        return (julianDay - J2000) / DAYS_PER_JULIAN_CENTURY;
    }
}
