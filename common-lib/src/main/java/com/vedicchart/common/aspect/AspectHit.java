package com.vedicchart.common.aspect;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One special-aspect angle that reaches the target. {@code orb} and {@code category}
 * are null in sign-based mode, where the whole sign is aspected at full strength.
 */
public record AspectHit(
    @JsonProperty("angle") int angle,
    @JsonProperty("orb") Double orb,
    @JsonProperty("category") OrbCategory category,
    @JsonProperty("strength") double strength
) {
    public static AspectHit wholeSign(int angle) {
        return new AspectHit(angle, null, null, 1.0);
    }

    public static AspectHit withOrb(int angle, double orb, OrbCategory category) {
        return new AspectHit(angle, orb, category, category.strength());
    }

    public String displayName() {
        return AspectAngles.displayName(angle);
    }
}
