package com.vedicchart.common.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Naisargika (natural) friendship table, keyed by the subject body.
 *
 * <p>The table is directional: Moon counts Mars as neutral while Mars counts Moon as a
 * friend. Lookups must always go through the subject. Pairs not listed resolve to
 * {@link Relationship#UNKNOWN}.
 */
public final class NaturalRelationships {

    private static final Map<Body, Map<Body, Relationship>> TABLE = new EnumMap<>(Body.class);

    static {
        define(Body.SUN,
            List.of(Body.MOON, Body.MARS, Body.JUPITER),
            List.of(Body.MERCURY),
            List.of(Body.VENUS, Body.SATURN, Body.RAHU, Body.KETU));
        define(Body.MOON,
            List.of(Body.SUN, Body.MERCURY),
            List.of(Body.MARS, Body.JUPITER, Body.VENUS, Body.SATURN),
            List.of(Body.RAHU, Body.KETU));
        define(Body.MARS,
            List.of(Body.SUN, Body.MOON, Body.JUPITER),
            List.of(Body.VENUS, Body.SATURN),
            List.of(Body.MERCURY, Body.RAHU, Body.KETU));
        define(Body.MERCURY,
            List.of(Body.SUN, Body.VENUS),
            List.of(Body.MARS, Body.JUPITER, Body.SATURN),
            List.of(Body.MOON, Body.RAHU, Body.KETU));
        define(Body.JUPITER,
            List.of(Body.SUN, Body.MOON, Body.MARS),
            List.of(Body.SATURN),
            List.of(Body.MERCURY, Body.VENUS, Body.RAHU, Body.KETU));
        define(Body.VENUS,
            List.of(Body.MERCURY, Body.SATURN),
            List.of(Body.MARS, Body.JUPITER),
            List.of(Body.SUN, Body.MOON, Body.RAHU, Body.KETU));
        define(Body.SATURN,
            List.of(Body.MERCURY, Body.VENUS),
            List.of(Body.JUPITER),
            List.of(Body.SUN, Body.MOON, Body.MARS, Body.RAHU, Body.KETU));
        define(Body.RAHU,
            List.of(Body.MERCURY, Body.VENUS, Body.SATURN),
            List.of(),
            List.of(Body.SUN, Body.MOON, Body.MARS, Body.JUPITER));
        define(Body.KETU,
            List.of(Body.MARS, Body.VENUS, Body.SATURN),
            List.of(),
            List.of(Body.SUN, Body.MOON, Body.MERCURY, Body.JUPITER));
    }

    private NaturalRelationships() {}

    public static Relationship of(Body subject, Body other) {
        return TABLE.get(subject).getOrDefault(other, Relationship.UNKNOWN);
    }

    /** Bodies the subject holds in the given relationship, in catalog order. */
    public static List<Body> bodiesWith(Body subject, Relationship relationship) {
        List<Body> result = new ArrayList<>();
        for (Map.Entry<Body, Relationship> entry : TABLE.get(subject).entrySet()) {
            if (entry.getValue() == relationship) {
                result.add(entry.getKey());
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static void define(Body subject, List<Body> friends, List<Body> neutrals, List<Body> enemies) {
        Map<Body, Relationship> row = new EnumMap<>(Body.class);
        friends.forEach(b -> row.put(b, Relationship.FRIEND));
        neutrals.forEach(b -> row.put(b, Relationship.NEUTRAL));
        enemies.forEach(b -> row.put(b, Relationship.ENEMY));
        TABLE.put(subject, Collections.unmodifiableMap(row));
    }
}
