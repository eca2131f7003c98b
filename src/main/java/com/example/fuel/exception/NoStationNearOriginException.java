package com.example.fuel.exception;

/**
 * No usable station lies within vehicle range of the origin.
 */
public class NoStationNearOriginException extends TripPlanningException {

    public NoStationNearOriginException(String message) {
        super(FailureReason.NO_STATION_NEAR_ORIGIN, message);
    }
}
