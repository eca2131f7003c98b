package com.example.fuel.service;

import com.example.fuel.exception.InvalidTripRequestException;
import com.example.fuel.model.CityState;
import com.example.fuel.model.PlannedStops;
import com.example.fuel.model.RouteData;
import com.example.fuel.model.TripPlan;
import com.example.fuel.model.TripResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Plans a trip end to end: route lookup, station prefilter, stop selection and cost totals.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TripService {

    private final RoutingProvider routingProvider;
    private final StationCatalog stationCatalog;
    private final StationPrefilter stationPrefilter;
    private final RouteStopPlanner routeStopPlanner;
    private final CostAggregator costAggregator;

    public TripPlan calculateTrip(String start, String finish) {
        CityState origin = parseLocation("start", start);
        CityState destination = parseLocation("finish", finish);

        RouteData route = routingProvider.getRoute(origin, destination);
        StationCatalog candidates = stationPrefilter.prefilter(route.getWaypoints(), stationCatalog);
        PlannedStops planned = routeStopPlanner.plan(route.getTotalDistanceMiles(), route.getWaypoints(), candidates);

        double totalCost = costAggregator.totalCost(planned.getStops());
        costAggregator.checkGallons(planned.getStops(), route.getTotalDistanceMiles());
        log.info("Trip {} -> {}: {} stop(s), total fuel cost {}{}", origin, destination, planned.getStops().size(),
                totalCost, planned.isTruncated() ? " (truncated)" : "");

        return TripPlan.builder()
                .totalDistanceMiles(route.getTotalDistanceMiles())
                .estimatedTravelTime(route.getEstimatedTravelTime())
                .stops(planned.getStops())
                .totalFuelCost(totalCost)
                .warnings(planned.getWarnings())
                .build();
    }

    /**
     * Distinct station cities, for origin/destination pickers.
     */
    public List<TripResponse.Location> availableLocations() {
        List<TripResponse.Location> locations = new ArrayList<>();
        for (CityState cityState : stationCatalog.locations()) {
            locations.add(new TripResponse.Location(cityState.displayCity(), cityState.getState()));
        }
        return locations;
    }

    private static CityState parseLocation(String parameter, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidTripRequestException("Missing '" + parameter + "' parameter");
        }
        CityState location = CityState.parse(value);
        if (!location.isResolved()) {
            throw new InvalidTripRequestException("Invalid '" + parameter + "' value '" + value
                    + "', expected 'City, ST'");
        }
        return location;
    }
}
