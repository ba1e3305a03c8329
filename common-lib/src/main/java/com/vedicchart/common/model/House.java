package com.vedicchart.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.angle.AngleMath;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.house.HouseNature;

import java.util.List;

/**
 * One bhava. Its span runs from its own cusp up to (not including) the next house's cusp.
 */
public record House(
    @JsonProperty("number") int number,
    @JsonProperty("cusp") double cusp,
    @JsonProperty("nextCusp") double nextCusp,
    @JsonProperty("sign") Sign sign,
    @JsonProperty("lord") Body lord,
    @JsonProperty("occupants") List<Body> occupants
) {
    public House {
        occupants = List.copyOf(occupants);
    }

    /** Bhava madhya: the midpoint of the forward arc from this cusp to the next. */
    public double madhya() {
        return AngleMath.arcMidpoint(cusp, nextCusp);
    }

    public double span() {
        return AngleMath.angularDistance(cusp, nextCusp, true);
    }

    public boolean contains(double longitude) {
        return AngleMath.isWithinArc(longitude, cusp, nextCusp);
    }

    public boolean isOccupied() {
        return !occupants.isEmpty();
    }

    public boolean isKendra()   { return HouseNature.isKendra(number); }
    public boolean isTrikona()  { return HouseNature.isTrikona(number); }
    public boolean isUpachaya() { return HouseNature.isUpachaya(number); }
    public boolean isDusthana() { return HouseNature.isDusthana(number); }
    public boolean isMaraka()   { return HouseNature.isMaraka(number); }
}
