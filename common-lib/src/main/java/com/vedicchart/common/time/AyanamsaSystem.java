package com.vedicchart.common.time;

import java.util.Arrays;
import java.util.Locale;

/**
 * Supported ayanamsa systems with their J2000 base values.
 *
 * <p>The model is linear: {@code base + PRECESSION_RATE × years since J2000}. No nutation
 * or other periodic terms.
 */
public enum AyanamsaSystem {

    LAHIRI("Lahiri", 23.85),
    RAMAN("Raman", 22.50),
    KRISHNAMURTI("Krishnamurti", 23.77),
    FAGAN_BRADLEY("Fagan_Bradley", 24.04);

    /** 50.29 arc-seconds of general precession per year, in degrees. */
    public static final double PRECESSION_RATE = 50.29 / 3600.0;

    public static final AyanamsaSystem DEFAULT = LAHIRI;

    private final String displayName;
    private final double baseAtJ2000;

    AyanamsaSystem(String displayName, double baseAtJ2000) {
        this.displayName = displayName;
        this.baseAtJ2000 = baseAtJ2000;
    }

    public String displayName() {
        return displayName;
    }

    public double baseAtJ2000() {
        return baseAtJ2000;
    }

    public double valueAt(double julianDay) {
        return baseAtJ2000 + PRECESSION_RATE * JulianDay.yearsSinceJ2000(julianDay);
    }

    /**
     * Resolves a system by display or constant name, ignoring case, spaces and hyphens.
     * Unrecognised or blank names resolve to {@link #DEFAULT}.
     */
    public static AyanamsaSystem fromName(String name) {
        if (name == null || name.isBlank()) {
            return DEFAULT;
        }
        String key = canonical(name);
        return Arrays.stream(values())
            .filter(s -> canonical(s.displayName).equals(key) || canonical(s.name()).equals(key))
            .findFirst()
            .orElse(DEFAULT);
    }

    private static String canonical(String raw) {
        return raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }
}
