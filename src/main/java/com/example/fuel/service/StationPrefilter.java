package com.example.fuel.service;

import com.example.fuel.config.FuelPlanProperties;
import com.example.fuel.model.CityState;
import com.example.fuel.model.Station;
import com.example.fuel.model.Waypoint;
import com.example.fuel.util.WaypointDistance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Cuts the catalog down to the stations plausibly reachable from a route. Stations with coordinates are
 * kept when they lie within the proximity threshold of some waypoint. Stations without coordinates are
 * kept when their city/state matches any geocoded route waypoint. Resolutions land in the {@link GeoCache},
 * so the planner's later lookups for the same waypoints make no external calls.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StationPrefilter {

    private final GeoCache geoCache;
    private final FuelPlanProperties properties;

    public StationCatalog prefilter(List<Waypoint> waypoints, StationCatalog allStations) {
        if (allStations.isEmpty()) {
            return allStations;
        }
        // validates the route before any lookups
        WaypointDistance.cumulativeDistance(waypoints);
        double proximity = properties.getPrefilterProximityMiles();

        boolean anyWithoutCoordinates = allStations.getStations().stream().anyMatch(s -> !s.hasCoordinates());
        Set<CityState> routeCities = anyWithoutCoordinates ? routeCities(waypoints) : Set.of();

        StationCatalog filtered = allStations.filter(station -> station.hasCoordinates()
                ? nearRoute(station, waypoints, proximity)
                : routeCities.contains(station.cityState()));

        log.info("Prefilter kept {} of {} stations ({} route cities resolved)",
                filtered.size(), allStations.size(), routeCities.size());
        return filtered;
    }

    static boolean nearRoute(Station station, List<Waypoint> waypoints, double proximityMiles) {
        for (Waypoint waypoint : waypoints) {
            double miles = WaypointDistance.haversineMiles(station.getLatitude(), station.getLongitude(),
                    waypoint.getLat(), waypoint.getLon());
            if (miles <= proximityMiles) {
                return true;
            }
        }
        return false;
    }

    private Set<CityState> routeCities(List<Waypoint> waypoints) {
        Set<CityState> cities = new HashSet<>();
        for (Waypoint waypoint : waypoints) {
            CityState cityState = geoCache.resolve(waypoint.getLat(), waypoint.getLon());
            if (cityState.isResolved()) {
                cities.add(cityState);
            }
        }
        return cities;
    }
}
