package com.example.fuel.exception;

public class RouteUnavailableException extends TripPlanningException {

    public RouteUnavailableException(String message) {
        super(FailureReason.ROUTE_UNAVAILABLE, message);
    }

    public RouteUnavailableException(String message, Throwable cause) {
        super(FailureReason.ROUTE_UNAVAILABLE, message, cause);
    }
}
