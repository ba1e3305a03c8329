package com.vedicchart.common.strength;

/**
 * Buckets for a strength score in [0, 1]. Lower bounds are inclusive.
 */
public enum StrengthCategory {
    VERY_STRONG("Very Strong", 0.8),
    STRONG("Strong", 0.6),
    MODERATE("Moderate", 0.4),
    WEAK("Weak", 0.2),
    VERY_WEAK("Very Weak", Double.NEGATIVE_INFINITY);

    private final String displayName;
    private final double lowerBound;

    StrengthCategory(String displayName, double lowerBound) {
        this.displayName = displayName;
        this.lowerBound = lowerBound;
    }

    public String displayName() {
        return displayName;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public static StrengthCategory of(double score) {
        for (StrengthCategory category : values()) {
            if (score >= category.lowerBound) {
                return category;
            }
        }
        return VERY_WEAK;
    }

    public boolean isAtLeast(StrengthCategory other) {
        return ordinal() <= other.ordinal();
    }
}
