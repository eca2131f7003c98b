package com.example.fuel.exception;

/**
 * Raised only when partial plans are configured to fail; otherwise the plan is truncated.
 */
public class PartialPlanException extends TripPlanningException {

    public PartialPlanException(String message) {
        super(FailureReason.PARTIAL_PLAN, message);
    }
}
