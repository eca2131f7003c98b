package com.example.fuel.service;

import com.example.fuel.model.CityState;

import java.util.Optional;

/**
 * Reverse geocoder. Implementations must be idempotent and may throw on transport failures.
 */
@FunctionalInterface
public interface GeocodingProvider {

    Optional<CityState> reverse(double lat, double lon);
}
