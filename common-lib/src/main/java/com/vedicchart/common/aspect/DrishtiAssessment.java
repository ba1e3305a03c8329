package com.vedicchart.common.aspect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.catalog.Nature;
import com.vedicchart.common.catalog.Sign;
import com.vedicchart.common.dignity.Dignity;

/**
 * Drishti-effect verdict for one aspect.
 *
 * @param aspectedSign sign the aspect falls in
 * @param dignity      aspecting body's dignity as if it stood at the aspected position
 * @param qualifier    "Strong" / "Moderate" / "Weak" in degree mode, null in sign mode
 * @param label        qualifier and effect joined for display, e.g. "Strong Very Auspicious"
 */
public record DrishtiAssessment(
    @JsonProperty("aspectedSign") Sign aspectedSign,
    @JsonProperty("dignity") Dignity dignity,
    @JsonProperty("tier") DrishtiTier tier,
    @JsonProperty("nature") Nature nature,
    @JsonProperty("effect") DrishtiEffect effect,
    @JsonProperty("qualifier") String qualifier,
    @JsonProperty("label") String label
) {
    public String description() {
        return label + " influence with " + dignity.displayName() + " dignity";
    }
}
