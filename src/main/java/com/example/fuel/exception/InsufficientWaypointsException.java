package com.example.fuel.exception;

/**
 * A route needs at least two waypoints.
 */
public class InsufficientWaypointsException extends TripPlanningException {

    public InsufficientWaypointsException(String message) {
        super(FailureReason.INSUFFICIENT_WAYPOINTS, message);
    }
}
