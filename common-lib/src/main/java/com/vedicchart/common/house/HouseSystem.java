package com.vedicchart.common.house;

import java.util.List;

/**
 * Produces the twelve house cusps for an ascendant. Only equal houses are implemented;
 * quadrant systems would plug in here.
 */
public interface HouseSystem {

    /** Cusps of houses 1..12 in order, sidereal degrees in [0, 360). */
    List<Double> cusps(double ascendant);

    String name();
}
