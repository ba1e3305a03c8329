package com.vedicchart.common.karaka;

/**
 * Jaimini chara karakas, highest degree first.
 */
public enum CharaKaraka {
    ATMAKARAKA("AK", "Atmakaraka"),
    AMATYAKARAKA("AmK", "Amatyakaraka"),
    BHRATRIKARAKA("BK", "Bhratrikaraka"),
    MATRIKARAKA("MK", "Matrikaraka"),
    PITRIKARAKA("PiK", "Pitrikaraka"),
    PUTRAKARAKA("PK", "Putrakaraka"),
    GNATIKARAKA("GK", "Gnatikaraka"),
    DARAKARAKA("DK", "Darakaraka");

    private final String abbreviation;
    private final String displayName;

    CharaKaraka(String abbreviation, String displayName) {
        this.abbreviation = abbreviation;
        this.displayName = displayName;
    }

    public String abbreviation() {
        return abbreviation;
    }

    public String displayName() {
        return displayName;
    }
}
