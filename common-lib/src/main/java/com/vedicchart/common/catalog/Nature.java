package com.vedicchart.common.catalog;

/** Natural benefic/malefic classification of a body. */
public enum Nature {
    BENEFIC("Benefic"),
    MALEFIC("Malefic"),
    NEUTRAL("Neutral");

    private final String displayName;

    Nature(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
