package com.vedicchart.common.catalog;

public enum Element {
    FIRE("Fire"),
    EARTH("Earth"),
    AIR("Air"),
    WATER("Water");

    private final String displayName;

    Element(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
