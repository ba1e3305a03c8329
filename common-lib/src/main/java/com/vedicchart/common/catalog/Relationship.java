package com.vedicchart.common.catalog;

/**
 * Natural relationship of one body towards another. {@link #UNKNOWN} is returned for
 * pairs the rule table does not list (the two nodes towards each other, a body
 * towards itself); it is never inferred from the reverse direction.
 */
public enum Relationship {
    FRIEND("Friend"),
    NEUTRAL("Neutral"),
    ENEMY("Enemy"),
    UNKNOWN("Unknown");

    private final String displayName;

    Relationship(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
