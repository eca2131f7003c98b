package com.example.fuel.exception;

import lombok.Getter;

/**
 * Base class for failures that abort a planning call and are reported to the caller.
 */
@Getter
public class TripPlanningException extends RuntimeException {

    private final FailureReason reason;

    public TripPlanningException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TripPlanningException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
