package com.example.fuel.service;

import com.example.fuel.model.CityState;
import com.example.fuel.model.Station;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Immutable, name-unique set of stations indexed by normalized city/state. Catalog order is preserved
 * and decides which station wins when a city has several.
 */
@Slf4j
public class StationCatalog {

    private final List<Station> stations;
    private final Map<CityState, List<Station>> byCityState;

    private StationCatalog(List<Station> stations) {
        this.stations = Collections.unmodifiableList(stations);
        Map<CityState, List<Station>> index = new LinkedHashMap<>();
        for (Station station : stations) {
            index.computeIfAbsent(station.cityState(), k -> new ArrayList<>()).add(station);
        }
        this.byCityState = index;
    }

    /**
     * Builds a catalog, keeping the first record for each station name.
     */
    public static StationCatalog of(Collection<Station> stations) {
        List<Station> unique = new ArrayList<>(stations.size());
        Set<String> names = new HashSet<>();
        int duplicates = 0;
        for (Station station : stations) {
            if (names.add(station.getName())) {
                unique.add(station);
            } else {
                duplicates++;
            }
        }
        if (duplicates > 0) {
            log.debug("Ignored {} duplicate station record(s)", duplicates);
        }
        return new StationCatalog(unique);
    }

    public static StationCatalog empty() {
        return new StationCatalog(new ArrayList<>());
    }

    /**
     * First station in the given city/state whose name is not in {@code usedNames}.
     */
    public Optional<Station> findUnused(CityState cityState, Set<String> usedNames) {
        if (cityState == null || !cityState.isResolved()) {
            return Optional.empty();
        }
        for (Station station : byCityState.getOrDefault(cityState, Collections.emptyList())) {
            if (!usedNames.contains(station.getName())) {
                return Optional.of(station);
            }
        }
        return Optional.empty();
    }

    public StationCatalog filter(Predicate<Station> predicate) {
        List<Station> kept = new ArrayList<>();
        for (Station station : stations) {
            if (predicate.test(station)) {
                kept.add(station);
            }
        }
        return new StationCatalog(kept);
    }

    /**
     * Distinct city/state pairs, ordered by state then city.
     */
    public List<CityState> locations() {
        Set<CityState> sorted = new TreeSet<>(Comparator.comparing(CityState::getState).thenComparing(CityState::getCity));
        for (CityState cityState : byCityState.keySet()) {
            if (cityState.isResolved()) {
                sorted.add(cityState);
            }
        }
        return new ArrayList<>(sorted);
    }

    public List<Station> getStations() {
        return stations;
    }

    public int size() {
        return stations.size();
    }

    public boolean isEmpty() {
        return stations.isEmpty();
    }
}
