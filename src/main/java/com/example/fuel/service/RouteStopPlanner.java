package com.example.fuel.service;

import com.example.fuel.config.FuelPlanProperties;
import com.example.fuel.exception.NoStationNearOriginException;
import com.example.fuel.exception.PartialPlanException;
import com.example.fuel.model.CityState;
import com.example.fuel.model.FuelStop;
import com.example.fuel.model.PlannedStops;
import com.example.fuel.model.Station;
import com.example.fuel.model.Waypoint;
import com.example.fuel.util.WaypointDistance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Greedy fuel stop selection along a route.
 *
 * <p>From the current position the planner scans forward over the waypoints reachable on one tank and
 * stops at the first waypoint whose city/state has an unused station. The first match wins, not the
 * nearest or the cheapest. Each station is used at most once and every leg is at most the vehicle range.
 *
 * <p>When nothing matches in the reachable window:
 * <ul>
 *   <li>at the origin the trip is infeasible and {@link NoStationNearOriginException} is thrown, also when
 *       the catalog is empty;</li>
 *   <li>after a stop, if the destination is within range the plan is complete;</li>
 *   <li>otherwise the plan is truncated with a warning, or {@link PartialPlanException} is thrown when
 *       {@code fuel.fail-on-partial-plan} is set.</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteStopPlanner {

    private final GeoCache geoCache;
    private final FuelPlanProperties properties;

    public PlannedStops plan(double totalDistance, List<Waypoint> waypoints, StationCatalog catalog) {
        double[] cumulative = WaypointDistance.cumulativeDistance(waypoints);
        double range = properties.getVehicleRangeMiles();

        List<FuelStop> stops = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<String> usedStations = new HashSet<>();
        double milesTraveled = 0;

        while (milesTraveled < totalDistance) {
            double maxReach = Math.min(milesTraveled + range, totalDistance);
            Candidate match = scan(milesTraveled, maxReach, cumulative, waypoints, catalog, usedStations);

            if (match == null) {
                if (milesTraveled == 0) {
                    throw new NoStationNearOriginException(catalog.isEmpty()
                            ? "No fuel stations found along the route"
                            : String.format("No fuel station found within %.0f miles of the origin", maxReach));
                }
                if (totalDistance - milesTraveled <= range) {
                    log.debug("Destination reachable from mile {} without another stop", milesTraveled);
                    break;
                }
                String warning = String.format(
                        "No fuel station found between mile %.2f and mile %.2f; plan ends %.2f miles short of the destination",
                        milesTraveled, maxReach, totalDistance - milesTraveled);
                if (properties.isFailOnPartialPlan()) {
                    throw new PartialPlanException(warning);
                }
                log.warn(warning);
                warnings.add(warning);
                return new PlannedStops(stops, true, warnings);
            }

            Station station = match.station;
            usedStations.add(station.getName());
            double distanceTraveled = match.miles - milesTraveled;
            double gallons = distanceTraveled / properties.getMilesPerGallon();
            double price = station.priceOr(properties.getFallbackPricePerGallon());
            stops.add(new FuelStop(station, match.miles, gallons, price, gallons * price));
            log.info("Fuel stop {} at {}, {} (mile {}, {} gallons)", station.getName(),
                    CityState.titleCase(station.getCity()), station.getState(),
                    String.format("%.2f", match.miles), String.format("%.2f", gallons));
            milesTraveled = match.miles;
        }
        return new PlannedStops(stops, false, warnings);
    }

    /**
     * First unused station at a waypoint strictly past {@code fromMiles} and no further than {@code maxReach}.
     */
    private Candidate scan(double fromMiles, double maxReach, double[] cumulative, List<Waypoint> waypoints,
                           StationCatalog catalog, Set<String> usedStations) {
        if (catalog.isEmpty()) {
            return null;
        }
        int start = WaypointDistance.distanceAtOrBefore(fromMiles, cumulative);
        for (int i = start; i < cumulative.length && cumulative[i] <= maxReach; i++) {
            if (cumulative[i] <= fromMiles) {
                continue;
            }
            Waypoint waypoint = waypoints.get(i);
            CityState cityState = geoCache.resolve(waypoint.getLat(), waypoint.getLon());
            if (!cityState.isResolved()) {
                log.debug("Skipping unresolved waypoint ({}, {})", waypoint.getLat(), waypoint.getLon());
                continue;
            }
            Optional<Station> station = catalog.findUnused(cityState, usedStations);
            if (station.isPresent()) {
                return new Candidate(station.get(), cumulative[i]);
            }
        }
        return null;
    }

    private static final class Candidate {
        private final Station station;
        private final double miles;

        private Candidate(Station station, double miles) {
            this.station = station;
            this.miles = miles;
        }
    }
}
