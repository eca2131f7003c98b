package com.example.fuel.model;

import lombok.Value;

import java.util.List;

/**
 * Route geometry and totals as returned by a routing provider.
 */
@Value
public class RouteData {
    double totalDistanceMiles;
    String estimatedTravelTime;
    List<Waypoint> waypoints;
}
