package com.example.fuel.exception;

/**
 * Raised for missing or malformed origin/destination input.
 */
public class InvalidTripRequestException extends TripPlanningException {

    public InvalidTripRequestException(String message) {
        super(FailureReason.INVALID_REQUEST, message);
    }
}
