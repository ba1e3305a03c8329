package com.vedicchart.common.house;

import com.vedicchart.common.catalog.Body;

import java.util.List;

/**
 * Traditional names and natural significators (karakas) of the twelve houses.
 */
public enum Bhava {
    TANU(1, "Lagna/Tanu Bhava", List.of(Body.SUN)),
    DHANA(2, "Dhana Bhava", List.of(Body.JUPITER)),
    SAHAJA(3, "Sahaja/Parakrama Bhava", List.of(Body.MARS)),
    SUKHA(4, "Sukha/Matru Bhava", List.of(Body.MOON)),
    PUTRA(5, "Putra/Vidya Bhava", List.of(Body.JUPITER)),
    ARI(6, "Ari/Roga Bhava", List.of(Body.MARS, Body.SATURN)),
    KALATRA(7, "Kalatra/Jaya Bhava", List.of(Body.VENUS)),
    AYU(8, "Ayu/Mrityu Bhava", List.of(Body.SATURN)),
    BHAGYA(9, "Bhagya/Dharma Bhava", List.of(Body.JUPITER, Body.SUN)),
    KARMA(10, "Karma/Rajya Bhava", List.of(Body.SUN, Body.MERCURY, Body.JUPITER, Body.SATURN)),
    LABHA(11, "Labha/Aya Bhava", List.of(Body.JUPITER)),
    VYAYA(12, "Vyaya/Moksha Bhava", List.of(Body.SATURN));

    private final int number;
    private final String displayName;
    private final List<Body> karakas;

    Bhava(int number, String displayName, List<Body> karakas) {
        this.number = number;
        this.displayName = displayName;
        this.karakas = karakas;
    }

    public int number()          { return number; }
    public String displayName()  { return displayName; }
    public List<Body> karakas()  { return karakas; }

    /**
     * @throws com.vedicchart.common.exception.CatalogLookupException when outside 1..12
     */
    public static Bhava of(int house) {
        return values()[HouseNature.requireValid(house) - 1];
    }
}
