package com.vedicchart.common.house;

import com.vedicchart.common.exception.CatalogLookupException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * House classification flags. Pure functions of the house number; they never depend on
 * the ascendant.
 */
public final class HouseNature {

    public static final Set<Integer> KENDRA   = Set.of(1, 4, 7, 10);
    public static final Set<Integer> TRIKONA  = Set.of(1, 5, 9);
    public static final Set<Integer> UPACHAYA = Set.of(3, 6, 10, 11);
    public static final Set<Integer> DUSTHANA = Set.of(6, 8, 12);
    public static final Set<Integer> MARAKA   = Set.of(2, 7);

    private HouseNature() {}

    public static boolean isKendra(int house)   { return KENDRA.contains(requireValid(house)); }
    public static boolean isTrikona(int house)  { return TRIKONA.contains(requireValid(house)); }
    public static boolean isUpachaya(int house) { return UPACHAYA.contains(requireValid(house)); }
    public static boolean isDusthana(int house) { return DUSTHANA.contains(requireValid(house)); }
    public static boolean isMaraka(int house)   { return MARAKA.contains(requireValid(house)); }

    /** The 7th house from {@code house}. */
    public static int opposite(int house) {
        return ((requireValid(house) + 5) % 12) + 1;
    }

    /**
     * Houses stepped forward from {@code from} to {@code to}, in 1..12; a house counted
     * to itself gives 12.
     */
    public static int countFrom(int from, int to) {
        int distance = requireValid(to) - requireValid(from);
        return distance <= 0 ? distance + 12 : distance;
    }

    /** Labels in the order Kendra, Trikona, Upachaya, Dusthana, Maraka. */
    public static List<String> labels(int house) {
        List<String> labels = new ArrayList<>();
        if (isKendra(house))   labels.add("Kendra");
        if (isTrikona(house))  labels.add("Trikona");
        if (isUpachaya(house)) labels.add("Upachaya");
        if (isDusthana(house)) labels.add("Dusthana");
        if (isMaraka(house))   labels.add("Maraka");
        return labels;
    }

    /**
     * @throws CatalogLookupException when {@code house} is outside 1..12
     */
    public static int requireValid(int house) {
        if (house < 1 || house > 12) {
            throw new CatalogLookupException("House", String.valueOf(house));
        }
        return house;
    }
}
