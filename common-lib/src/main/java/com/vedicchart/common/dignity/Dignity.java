package com.vedicchart.common.dignity;

/**
 * Sign-based dignity of a body. Exactly one value applies to any body at any longitude.
 */
public enum Dignity {
    EXALTED_EXACT("Exalted (exact)", "Uccha"),
    EXALTED("Exalted", "Uccha"),
    DEBILITATED_EXACT("Debilitated (exact)", "Neecha"),
    DEBILITATED("Debilitated", "Neecha"),
    MOOLATRIKONA("Moolatrikona", "Moolatrikona"),
    OWN_SIGN("Own Sign", "Swakshetra"),
    NEUTRAL("Neutral", "Sama");

    private final String displayName;
    private final String sanskritName;

    Dignity(String displayName, String sanskritName) {
        this.displayName = displayName;
        this.sanskritName = sanskritName;
    }

    public String displayName() {
        return displayName;
    }

    public String sanskritName() {
        return sanskritName;
    }

    public boolean isExalted() {
        return this == EXALTED || this == EXALTED_EXACT;
    }

    public boolean isDebilitated() {
        return this == DEBILITATED || this == DEBILITATED_EXACT;
    }

    public boolean isOwnOrMoolatrikona() {
        return this == OWN_SIGN || this == MOOLATRIKONA;
    }

    /** Exalted, own sign or moolatrikona. */
    public boolean isDignified() {
        return isExalted() || isOwnOrMoolatrikona();
    }
}
