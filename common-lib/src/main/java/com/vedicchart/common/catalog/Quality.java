package com.vedicchart.common.catalog;

/**
 * Sign modality. The traditional names (Movable, Fixed, Dual) drive the sign-to-sign
 * aspect rules in {@link Sign#rasiAspects()}.
 */
public enum Quality {
    CARDINAL("Cardinal", "Movable"),
    FIXED("Fixed", "Fixed"),
    MUTABLE("Mutable", "Dual");

    private final String displayName;
    private final String traditionalName;

    Quality(String displayName, String traditionalName) {
        this.displayName = displayName;
        this.traditionalName = traditionalName;
    }

    public String displayName() {
        return displayName;
    }

    public String traditionalName() {
        return traditionalName;
    }

    /** The modality this one casts sign aspects onto. */
    public Quality aspectedQuality() {
        return switch (this) {
            case CARDINAL -> FIXED;
            case FIXED    -> MUTABLE;
            case MUTABLE  -> CARDINAL;
        };
    }
}
