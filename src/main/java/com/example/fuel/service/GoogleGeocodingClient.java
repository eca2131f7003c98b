package com.example.fuel.service;

import com.example.fuel.model.CityState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.Optional;

/**
 * Reverse geocoding backed by the Google Geocoding API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GoogleGeocodingClient implements GeocodingProvider {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${google.maps.api.key:}")
    private String googleApiKey;

    @Value("${google.geocode.api.url:https://maps.googleapis.com/maps/api/geocode/json}")
    private String geocodeApiUrl;

    @Override
    public Optional<CityState> reverse(double lat, double lon) {
        URI uri = UriComponentsBuilder.fromHttpUrl(geocodeApiUrl)
                .queryParam("latlng", lat + "," + lon)
                .queryParam("key", googleApiKey)
                .encode()
                .build()
                .toUri();

        // Transport errors propagate; the cache decides how to treat them
        String body = restTemplate.getForObject(uri, String.class);
        if (body == null) {
            return Optional.empty();
        }
        try {
            return parse(objectMapper.readTree(body), lat, lon);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unreadable geocoding response for " + lat + "," + lon, ex);
        }
    }

    Optional<CityState> parse(JsonNode root, double lat, double lon) {
        if (!"OK".equals(root.path("status").asText())) {
            log.warn("Geocoding API error for ({}, {}): {}", lat, lon,
                    root.path("error_message").asText(root.path("status").asText("no data received")));
            return Optional.empty();
        }

        String city = null;
        String state = null;
        for (JsonNode component : root.path("results").path(0).path("address_components")) {
            for (JsonNode type : component.path("types")) {
                if ("locality".equals(type.asText())) {
                    city = component.path("long_name").asText(null);
                } else if ("administrative_area_level_1".equals(type.asText())) {
                    state = component.path("short_name").asText(null);
                }
            }
        }

        CityState resolved = CityState.of(city, state);
        if (!resolved.isResolved()) {
            log.debug("No locality/state in geocoding result for ({}, {})", lat, lon);
            return Optional.empty();
        }
        log.debug("Matched ({}, {}) to {}", lat, lon, resolved);
        return Optional.of(resolved);
    }
}
