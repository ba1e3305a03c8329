package com.vedicchart.common.chart;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.aspect.AspectMode;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.house.HouseBuilder;
import com.vedicchart.common.model.BodyPosition;
import com.vedicchart.common.model.House;
import com.vedicchart.common.time.AyanamsaSystem;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One computed chart. Read-only once built; nothing in it is shared with another chart.
 *
 * <p>An incomplete chart omits bodies the ephemeris did not supply (listed in
 * {@link #missingBodies()}) and, without an ascendant, all houses.
 */
public record ChartContext(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("julianDay") double julianDay,
    @JsonProperty("ayanamsaSystem") AyanamsaSystem ayanamsaSystem,
    @JsonProperty("ayanamsa") double ayanamsa,
    @JsonProperty("aspectMode") AspectMode aspectMode,
    @JsonProperty("ascendant") Double ascendant,
    @JsonProperty("ascendantFromFallback") boolean ascendantFromFallback,
    @JsonProperty("positions") Map<Body, BodyPosition> positions,
    @JsonProperty("houses") List<House> houses,
    @JsonProperty("missingBodies") List<Body> missingBodies,
    @JsonProperty("conjunctionOrb") double conjunctionOrb
) {
    public ChartContext {
        Map<Body, BodyPosition> ordered = new EnumMap<>(Body.class);
        ordered.putAll(positions);
        positions = Collections.unmodifiableMap(ordered);
        houses = List.copyOf(houses);
        missingBodies = List.copyOf(missingBodies);
    }

    @JsonProperty("housesAvailable")
    public boolean housesAvailable() {
        return ascendant != null && !houses.isEmpty();
    }

    @JsonProperty("complete")
    public boolean isComplete() {
        return missingBodies.isEmpty() && housesAvailable();
    }

    public Optional<BodyPosition> position(Body body) {
        return Optional.ofNullable(positions.get(body));
    }

    /**
     * @throws IllegalStateException when the chart has no houses
     */
    public House house(int number) {
        if (!housesAvailable()) {
            throw new IllegalStateException("Chart has no houses: ascendant unavailable");
        }
        return HouseBuilder.house(houses, number);
    }

    /** House the body occupies; empty when the body or the houses are missing. */
    public Optional<Integer> houseOf(Body body) {
        if (!housesAvailable()) {
            return Optional.empty();
        }
        return position(body).map(p -> HouseBuilder.houseOf(p.longitude(), houses));
    }

    @JsonIgnore
    public List<BodyPosition> bodyPositions() {
        return List.copyOf(positions.values());
    }
}
