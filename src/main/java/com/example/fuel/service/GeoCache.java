package com.example.fuel.service;

import com.example.fuel.model.CityState;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide memo of coordinate to city/state resolutions, keyed by coordinates rounded to four decimals.
 * Failed lookups are stored as {@link CityState#UNRESOLVED} so they are never retried. Entries are never evicted.
 */
@Slf4j
@Component
public class GeoCache {

    private final GeocodingProvider geocodingProvider;
    private final Map<Key, CityState> entries = new ConcurrentHashMap<>();

    public GeoCache(GeocodingProvider geocodingProvider) {
        this.geocodingProvider = geocodingProvider;
    }

    /**
     * Resolves the city/state for a coordinate. Never throws for lookup failures: those come back as
     * {@link CityState#UNRESOLVED}.
     */
    public CityState resolve(double lat, double lon) {
        Key key = Key.of(lat, lon);
        CityState cached = entries.get(key);
        if (cached != null) {
            return cached;
        }

        CityState resolved = lookup(lat, lon);
        // Concurrent callers may both miss; they compute the same value so the first write wins
        CityState previous = entries.putIfAbsent(key, resolved);
        return previous != null ? previous : resolved;
    }

    private CityState lookup(double lat, double lon) {
        try {
            return geocodingProvider.reverse(lat, lon).orElseGet(() -> {
                log.warn("Could not determine city/state for ({}, {})", lat, lon);
                return CityState.UNRESOLVED;
            });
        } catch (RuntimeException ex) {
            log.warn("Reverse geocoding failed for ({}, {}): {}", lat, lon, ex.getMessage());
            return CityState.UNRESOLVED;
        }
    }

    @Value
    private static class Key {
        long lat;
        long lon;

        static Key of(double lat, double lon) {
            return new Key(Math.round(lat * 1e4), Math.round(lon * 1e4));
        }
    }
}
