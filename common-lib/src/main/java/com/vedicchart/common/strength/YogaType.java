package com.vedicchart.common.strength;

public enum YogaType {
    KENDRA_TRIKONA("Kendra-Trikona Yoga"),
    PARIVARTANA("Parivartana Yoga"),
    CONJUNCTION("Conjunction Yoga"),
    DHANA("Dhana Yoga");

    private final String displayName;

    YogaType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
