package com.vedicchart.common.aspect;

import com.vedicchart.common.dignity.Dignity;

/**
 * Dignity tier of an aspecting body at the aspected position, the row key of the
 * drishti-effect table. {@link #of} never yields {@link #FRIEND} or {@link #ENEMY}: the
 * dignity chain has no friend or enemy outcome, so those rows are reached only through
 * {@link DrishtiClassifier#classify} directly.
 */
public enum DrishtiTier {
    DIGNIFIED("Dignified"),
    FRIEND("Friend"),
    NEUTRAL("Neutral"),
    ENEMY("Enemy"),
    DEBILITATED("Debilitated");

    private final String displayName;

    DrishtiTier(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Exalted (exact or not), own sign and moolatrikona collapse to {@link #DIGNIFIED}; either
     * debilitation variant to {@link #DEBILITATED}; everything else is {@link #NEUTRAL}.
     */
    public static DrishtiTier of(Dignity dignity) {
        if (dignity.isDignified()) {
            return DIGNIFIED;
        }
        if (dignity.isDebilitated()) {
            return DEBILITATED;
        }
        return NEUTRAL;
    }
}
