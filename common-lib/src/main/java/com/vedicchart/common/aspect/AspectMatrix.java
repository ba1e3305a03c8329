package com.vedicchart.common.aspect;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vedicchart.common.catalog.Body;
import com.vedicchart.common.model.BodyPosition;
import com.vedicchart.common.model.House;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Every directed aspect of a chart in one mode: body → body (including the non-aspecting
 * self pairs) and body → house. Only bodies present in the chart appear.
 */
public record AspectMatrix(
    @JsonProperty("mode") AspectMode mode,
    @JsonProperty("toBodies") Map<Body, Map<Body, AspectResult>> toBodies,
    @JsonProperty("toHouses") Map<Body, Map<Integer, AspectResult>> toHouses
) {
    private static final Comparator<AspectResult> STRONGEST_FIRST =
        Comparator.comparingDouble(AspectResult::totalStrength).reversed()
            .thenComparing(r -> r.source().ordinal());

    public static AspectMatrix compute(AspectEngine engine, Collection<BodyPosition> positions, List<House> houses) {
        Map<Body, Map<Body, AspectResult>> toBodies = new EnumMap<>(Body.class);
        Map<Body, Map<Integer, AspectResult>> toHouses = new EnumMap<>(Body.class);

        for (BodyPosition source : positions) {
            Map<Body, AspectResult> bodyRow = new EnumMap<>(Body.class);
            for (BodyPosition target : positions) {
                bodyRow.put(target.body(), engine.aspect(source, AspectTarget.of(target)));
            }
            toBodies.put(source.body(), Collections.unmodifiableMap(bodyRow));

            Map<Integer, AspectResult> houseRow = new TreeMap<>();
            for (House house : houses) {
                houseRow.put(house.number(), engine.aspect(source, AspectTarget.of(house)));
            }
            toHouses.put(source.body(), Collections.unmodifiableMap(houseRow));
        }
        return new AspectMatrix(engine.mode(),
            Collections.unmodifiableMap(toBodies), Collections.unmodifiableMap(toHouses));
    }

    public Optional<AspectResult> between(Body source, Body target) {
        return Optional.ofNullable(toBodies.getOrDefault(source, Map.of()).get(target));
    }

    /** Aspecting results that land on {@code house}, strongest first. */
    public List<AspectResult> aspectsToHouse(int house) {
        return toHouses.values().stream()
            .map(row -> row.get(house))
            .filter(r -> r != null && r.aspecting())
            .sorted(STRONGEST_FIRST)
            .collect(Collectors.toList());
    }

    public List<AspectResult> aspectsToBody(Body target) {
        return toBodies.values().stream()
            .map(row -> row.get(target))
            .filter(r -> r != null && r.aspecting())
            .sorted(STRONGEST_FIRST)
            .collect(Collectors.toList());
    }

    public List<AspectResult> aspectsFromBody(Body source) {
        return toBodies.getOrDefault(source, Map.of()).values().stream()
            .filter(AspectResult::aspecting)
            .collect(Collectors.toList());
    }

    /** All aspecting body → body results, by source then target order. */
    public List<AspectResult> bodyAspects() {
        List<AspectResult> all = new ArrayList<>();
        toBodies.values().forEach(row -> row.values().stream()
            .filter(AspectResult::aspecting)
            .forEach(all::add));
        return all;
    }
}
