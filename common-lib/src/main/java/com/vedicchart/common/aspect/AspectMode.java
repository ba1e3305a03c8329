package com.vedicchart.common.aspect;

import com.vedicchart.common.exception.CatalogLookupException;

import java.util.Locale;

/**
 * Sign-based ({@link #RASI}) or orb-based ({@link #DEGREE}) aspect evaluation.
 * Chosen once per chart and carried on the chart, never held globally.
 */
public enum AspectMode {
    RASI("rasi", "Rasi-based"),
    DEGREE("degree", "Degree-based");

    private final String key;
    private final String displayName;

    AspectMode(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String key() {
        return key;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * @throws CatalogLookupException for anything other than "rasi" or "degree" (any case)
     */
    public static AspectMode fromName(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (AspectMode mode : values()) {
                if (mode.key.equals(key)) {
                    return mode;
                }
            }
        }
        throw new CatalogLookupException("AspectMode", name);
    }
}
