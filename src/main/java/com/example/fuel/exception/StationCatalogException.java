package com.example.fuel.exception;

public class StationCatalogException extends TripPlanningException {

    public StationCatalogException(String message) {
        super(FailureReason.STATION_CATALOG_UNAVAILABLE, message);
    }

    public StationCatalogException(String message, Throwable cause) {
        super(FailureReason.STATION_CATALOG_UNAVAILABLE, message, cause);
    }
}
