package com.vedicchart.common.aspect;

/**
 * Qualitative outcome of an aspect.
 */
public enum DrishtiEffect {
    VERY_AUSPICIOUS("Very Auspicious", Polarity.AUSPICIOUS),
    AUSPICIOUS("Auspicious", Polarity.AUSPICIOUS),
    MILDLY_AUSPICIOUS("Mildly Auspicious", Polarity.AUSPICIOUS),
    NEUTRAL("Neutral", Polarity.NEUTRAL),
    MILDLY_INAUSPICIOUS("Mildly Inauspicious", Polarity.INAUSPICIOUS),
    INAUSPICIOUS("Inauspicious", Polarity.INAUSPICIOUS),
    VERY_INAUSPICIOUS("Very Inauspicious", Polarity.INAUSPICIOUS),
    EXTREMELY_INAUSPICIOUS("Extremely Inauspicious", Polarity.INAUSPICIOUS);

    public enum Polarity { AUSPICIOUS, NEUTRAL, INAUSPICIOUS }

    private final String displayName;
    private final Polarity polarity;

    DrishtiEffect(String displayName, Polarity polarity) {
        this.displayName = displayName;
        this.polarity = polarity;
    }

    public String displayName() {
        return displayName;
    }

    public Polarity polarity() {
        return polarity;
    }
}
