package com.vedicchart.common.angle;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * An angle split into whole degrees, whole minutes and fractional seconds.
 * The parts are always non-negative; {@code negative} carries the sign.
 */
public record Dms(
    @JsonProperty("degrees") int degrees,
    @JsonProperty("minutes") int minutes,
    @JsonProperty("seconds") double seconds,
    @JsonProperty("negative") boolean negative
) {
    public static Dms of(double value) {
        boolean negative = value < 0;
        double abs = Math.abs(value);
        int deg = (int) Math.floor(abs);
        double minutesRaw = (abs - deg) * 60.0;
        int min = (int) Math.floor(minutesRaw);
        double sec = (minutesRaw - min) * 60.0;
        // 59.9999999 seconds carries over
        if (sec >= 59.995) {
            sec = 0.0;
            min += 1;
        }
        if (min >= 60) {
            min -= 60;
            deg += 1;
        }
        return new Dms(deg, min, sec, negative);
    }

    public double toDegrees() {
        double magnitude = AngleMath.fromDms(degrees, minutes, seconds);
        return negative ? -magnitude : magnitude;
    }

    /** Renders as {@code 12°30'15.00"}. */
    public String format() {
        return String.format(Locale.ROOT, "%s%d°%02d'%05.2f\"", negative ? "-" : "", degrees, minutes, seconds);
    }
}
