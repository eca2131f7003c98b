package com.example.fuel.util;

import com.example.fuel.exception.InsufficientWaypointsException;
import com.example.fuel.model.Waypoint;

import java.util.List;

/**
 * Great-circle distances along an ordered list of waypoints. Consecutive waypoints are joined by
 * straight lines, so the result approximates road distance rather than measuring it.
 */
public final class WaypointDistance {

    private static final double EARTH_RADIUS_MILES = 3958.8;

    private WaypointDistance() {
    }

    public static double haversineMiles(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
                Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2)) *
                Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_MILES * c;
    }

    public static double haversineMiles(Waypoint a, Waypoint b) {
        return haversineMiles(a.getLat(), a.getLon(), b.getLat(), b.getLon());
    }

    /**
     * Running totals along the route: element {@code i} is the distance from the first waypoint to waypoint {@code i}.
     */
    public static double[] cumulativeDistance(List<Waypoint> waypoints) {
        requireRoute(waypoints);
        double[] cumulative = new double[waypoints.size()];
        for (int i = 1; i < waypoints.size(); i++) {
            cumulative[i] = cumulative[i - 1] + haversineMiles(waypoints.get(i - 1), waypoints.get(i));
        }
        return cumulative;
    }

    /**
     * Index of the last waypoint whose cumulative distance is at most {@code targetMiles}.
     * Targets at or below zero give the first waypoint; targets past the end give the last one.
     */
    public static int distanceAtOrBefore(double targetMiles, List<Waypoint> waypoints) {
        return distanceAtOrBefore(targetMiles, cumulativeDistance(waypoints));
    }

    public static int distanceAtOrBefore(double targetMiles, double[] cumulative) {
        if (cumulative.length < 2) {
            throw new InsufficientWaypointsException("Route has " + cumulative.length + " waypoint(s), at least 2 required");
        }
        if (targetMiles <= 0) {
            return 0;
        }
        int last = cumulative.length - 1;
        if (targetMiles >= cumulative[last]) {
            return last;
        }
        // Cumulative distances are non-decreasing, so binary search for the last value <= target
        int lo = 0;
        int hi = last;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (cumulative[mid] <= targetMiles) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    private static void requireRoute(List<Waypoint> waypoints) {
        if (waypoints == null || waypoints.size() < 2) {
            int count = waypoints == null ? 0 : waypoints.size();
            throw new InsufficientWaypointsException("Route has " + count + " waypoint(s), at least 2 required");
        }
    }
}
