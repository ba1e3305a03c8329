package com.vedicchart.common.catalog;

import com.vedicchart.common.exception.CatalogLookupException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The nine computational bodies: seven classical planets and the two lunar nodes.
 *
 * <p>Each constant carries its fixed rule data: natural nature, owned signs, exaltation
 * and debilitation points, moolatrikona span and special-aspect angles with their
 * retrograde substitutions. Natural friendships live in {@link NaturalRelationships}.
 */
public enum Body {

    SUN("Sun", "Surya", Nature.MALEFIC,
        List.of(Sign.LEO),
        new ZodiacPoint(Sign.ARIES, 10), new ZodiacPoint(Sign.LIBRA, 10),
        new DegreeSpan(Sign.LEO, 0, 20),
        List.of(180), Map.of()),

    MOON("Moon", "Chandra", Nature.BENEFIC,
        List.of(Sign.CANCER),
        new ZodiacPoint(Sign.TAURUS, 3), new ZodiacPoint(Sign.SCORPIO, 3),
        new DegreeSpan(Sign.TAURUS, 4, 30),
        List.of(180), Map.of()),

    MARS("Mars", "Mangala", Nature.MALEFIC,
        List.of(Sign.ARIES, Sign.SCORPIO),
        new ZodiacPoint(Sign.CAPRICORN, 28), new ZodiacPoint(Sign.CANCER, 28),
        new DegreeSpan(Sign.ARIES, 0, 12),
        List.of(90, 180, 210), Map.of(90, 270, 210, 150)),

    MERCURY("Mercury", "Budha", Nature.NEUTRAL,
        List.of(Sign.GEMINI, Sign.VIRGO),
        new ZodiacPoint(Sign.VIRGO, 15), new ZodiacPoint(Sign.PISCES, 15),
        new DegreeSpan(Sign.VIRGO, 16, 20),
        List.of(180), Map.of()),

    JUPITER("Jupiter", "Guru", Nature.BENEFIC,
        List.of(Sign.SAGITTARIUS, Sign.PISCES),
        new ZodiacPoint(Sign.CANCER, 5), new ZodiacPoint(Sign.CAPRICORN, 5),
        new DegreeSpan(Sign.SAGITTARIUS, 0, 10),
        List.of(120, 180, 240), Map.of()),

    VENUS("Venus", "Shukra", Nature.BENEFIC,
        List.of(Sign.TAURUS, Sign.LIBRA),
        new ZodiacPoint(Sign.PISCES, 27), new ZodiacPoint(Sign.VIRGO, 27),
        new DegreeSpan(Sign.LIBRA, 0, 15),
        List.of(180), Map.of()),

    SATURN("Saturn", "Shani", Nature.MALEFIC,
        List.of(Sign.CAPRICORN, Sign.AQUARIUS),
        new ZodiacPoint(Sign.LIBRA, 20), new ZodiacPoint(Sign.ARIES, 20),
        new DegreeSpan(Sign.AQUARIUS, 0, 20),
        List.of(60, 180, 270), Map.of(60, 300, 270, 90)),

    RAHU("Rahu", "Rahu", Nature.MALEFIC,
        List.of(),
        new ZodiacPoint(Sign.GEMINI, 15), new ZodiacPoint(Sign.SAGITTARIUS, 15),
        new DegreeSpan(Sign.GEMINI, 0, 30),
        List.of(120, 240), Map.of()),

    KETU("Ketu", "Ketu", Nature.MALEFIC,
        List.of(),
        new ZodiacPoint(Sign.SAGITTARIUS, 15), new ZodiacPoint(Sign.GEMINI, 15),
        new DegreeSpan(Sign.SAGITTARIUS, 0, 30),
        List.of(120, 240), Map.of());

    private final String displayName;
    private final String sanskritName;
    private final Nature nature;
    private final List<Sign> ownedSigns;
    private final ZodiacPoint exaltation;
    private final ZodiacPoint debilitation;
    private final DegreeSpan moolatrikona;
    private final List<Integer> baseAspectAngles;
    private final Map<Integer, Integer> retrogradeAngleSwaps;

    Body(String displayName, String sanskritName, Nature nature, List<Sign> ownedSigns,
         ZodiacPoint exaltation, ZodiacPoint debilitation, DegreeSpan moolatrikona,
         List<Integer> baseAspectAngles, Map<Integer, Integer> retrogradeAngleSwaps) {
        this.displayName = displayName;
        this.sanskritName = sanskritName;
        this.nature = nature;
        this.ownedSigns = ownedSigns;
        this.exaltation = exaltation;
        this.debilitation = debilitation;
        this.moolatrikona = moolatrikona;
        this.baseAspectAngles = baseAspectAngles;
        this.retrogradeAngleSwaps = retrogradeAngleSwaps;
    }

    public String displayName()        { return displayName; }
    public String sanskritName()       { return sanskritName; }
    public Nature nature()             { return nature; }
    public List<Sign> ownedSigns()     { return ownedSigns; }
    public ZodiacPoint exaltation()    { return exaltation; }
    public ZodiacPoint debilitation()  { return debilitation; }
    public DegreeSpan moolatrikona()   { return moolatrikona; }

    /** Special-aspect angles measured forward from the body, before any retrograde swap. */
    public List<Integer> baseAspectAngles() {
        return baseAspectAngles;
    }

    /** Angle substitutions applied while retrograde; angles absent from the map are unchanged. */
    public Map<Integer, Integer> retrogradeAngleSwaps() {
        return retrogradeAngleSwaps;
    }

    public boolean owns(Sign sign) {
        return ownedSigns.contains(sign);
    }

    public boolean isNode() {
        return this == RAHU || this == KETU;
    }

    public boolean isBenefic() {
        return nature == Nature.BENEFIC;
    }

    public boolean isMalefic() {
        return nature == Nature.MALEFIC;
    }

    public List<Body> naturalFriends() {
        return NaturalRelationships.bodiesWith(this, Relationship.FRIEND);
    }

    public List<Body> naturalNeutrals() {
        return NaturalRelationships.bodiesWith(this, Relationship.NEUTRAL);
    }

    public List<Body> naturalEnemies() {
        return NaturalRelationships.bodiesWith(this, Relationship.ENEMY);
    }

    /**
     * Resolves a body by English name, Sanskrit name or constant name, ignoring case.
     *
     * @throws CatalogLookupException when the name matches no body
     */
    public static Body fromName(String name) {
        return find(name).orElseThrow(() -> new CatalogLookupException("Body", name));
    }

    public static Optional<Body> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toUpperCase(Locale.ROOT);
        for (Body body : values()) {
            if (body.name().equals(key) || body.sanskritName.toUpperCase(Locale.ROOT).equals(key)) {
                return Optional.of(body);
            }
        }
        return Optional.empty();
    }
}
