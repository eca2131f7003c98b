package com.example.fuel.service;

import com.example.fuel.exception.RouteUnavailableException;
import com.example.fuel.model.CityState;
import com.example.fuel.model.RouteData;
import com.example.fuel.model.Waypoint;
import com.example.fuel.util.Polyline;
import com.example.fuel.util.Rounding;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * Routing backed by the Google Directions API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GoogleDirectionsClient implements RoutingProvider {

    static final double MILES_PER_METER = 0.000621371;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${google.maps.api.key:}")
    private String googleApiKey;

    @Value("${google.directions.api.url:https://maps.googleapis.com/maps/api/directions/json}")
    private String directionsApiUrl;

    @Override
    public RouteData getRoute(CityState origin, CityState destination) {
        URI uri = UriComponentsBuilder.fromHttpUrl(directionsApiUrl)
                .queryParam("origin", origin.toString())
                .queryParam("destination", destination.toString())
                .queryParam("mode", "driving")
                .queryParam("key", googleApiKey)
                .encode()
                .build()
                .toUri();

        ResponseEntity<String> response;
        try {
            response = restTemplate.getForEntity(uri, String.class);
        } catch (RestClientException ex) {
            log.error("Directions request {} -> {} failed: {}", origin, destination, ex.getMessage());
            throw new RouteUnavailableException("Routing service unavailable for " + origin + " -> " + destination, ex);
        }
        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            log.error("Directions API error: {}", response.getStatusCode());
            throw new RouteUnavailableException("No route found from " + origin + " to " + destination);
        }
        return parse(response.getBody(), origin, destination);
    }

    RouteData parse(String body, CityState origin, CityState destination) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new RouteUnavailableException("Unreadable routing response for " + origin + " -> " + destination, ex);
        }

        JsonNode routeNode = root.path("routes").path(0);
        JsonNode leg = routeNode.path("legs").path(0);
        if (routeNode.isMissingNode() || leg.isMissingNode()) {
            log.warn("Directions API returned no route ({}): {}", root.path("status").asText(),
                    root.path("error_message").asText("no message"));
            throw new RouteUnavailableException("No route found from " + origin + " to " + destination);
        }

        String encodedPolyline = routeNode.path("overview_polyline").path("points").asText("");
        if (encodedPolyline.isEmpty()) {
            throw new RouteUnavailableException("Route from " + origin + " to " + destination + " has no geometry");
        }

        double totalMiles = Rounding.cents(leg.path("distance").path("value").asDouble(0) * MILES_PER_METER);
        String travelTime = leg.path("duration").path("text").asText("");
        List<Waypoint> waypoints;
        try {
            waypoints = Polyline.decode(encodedPolyline);
        } catch (IllegalArgumentException ex) {
            throw new RouteUnavailableException("Route geometry could not be decoded", ex);
        }
        log.info("Route {} -> {}: {} miles, {}, {} waypoints", origin, destination, totalMiles, travelTime, waypoints.size());
        return new RouteData(totalMiles, travelTime, waypoints);
    }
}
