package com.vedicchart.common.aspect;

/**
 * Orb buckets for degree-based aspects. Each upper bound is inclusive: an orb of exactly
 * 3.0° is {@link #CLOSE}, 3.01° is {@link #WIDE}.
 */
public enum OrbCategory {
    EXACT("exact", 1.0, 1.0),
    CLOSE("close", 3.0, 0.75),
    WIDE("wide", 5.0, 0.5),
    VERY_WIDE("very_wide", 8.0, 0.25),
    NONE("none", Double.POSITIVE_INFINITY, 0.0);

    /** Largest orb that still counts as an aspect. */
    public static final double MAX_ORB = 8.0;

    private final String key;
    private final double maxOrb;
    private final double strength;

    OrbCategory(String key, double maxOrb, double strength) {
        this.key = key;
        this.maxOrb = maxOrb;
        this.strength = strength;
    }

    public String key()       { return key; }
    public double maxOrb()    { return maxOrb; }
    public double strength()  { return strength; }

    public boolean isAspect() {
        return this != NONE;
    }

    public static OrbCategory classify(double orb) {
        double abs = Math.abs(orb);
        for (OrbCategory category : values()) {
            if (abs <= category.maxOrb) {
                return category;
            }
        }
        return NONE;
    }
}
