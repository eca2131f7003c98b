package com.example.fuel.exception;

/**
 * Machine-readable cause of a rejected trip request.
 */
public enum FailureReason {
    INVALID_REQUEST,
    INSUFFICIENT_WAYPOINTS,
    ROUTE_UNAVAILABLE,
    NO_STATION_NEAR_ORIGIN,
    PARTIAL_PLAN,
    STATION_CATALOG_UNAVAILABLE
}
