package com.example.fuel.model;

import lombok.Builder;
import lombok.Value;

/**
 * A fuel retailer. City and state are stored normalized; price and coordinates are optional.
 */
@Value
@Builder
public class Station {
    String name;
    String address;
    String city;
    String state;
    Double pricePerGallon;
    Double latitude;
    Double longitude;

    public CityState cityState() {
        return CityState.of(city, state);
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    public double priceOr(double fallback) {
        return pricePerGallon != null ? pricePerGallon : fallback;
    }
}
