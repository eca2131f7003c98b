package com.example.fuel.controller;

import com.example.fuel.exception.TripPlanningException;
import com.example.fuel.model.TripResponse;
import com.example.fuel.service.TripService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TripController {

    private final TripService tripService;

    @GetMapping("/locations")
    public List<TripResponse.Location> locations() {
        return tripService.availableLocations();
    }

    @GetMapping("/calculate_trip")
    public ResponseEntity<?> calculateTrip(@RequestParam(required = false) String start,
                                           @RequestParam(required = false) String finish) {
        try {
            return ResponseEntity.ok(TripResponse.from(tripService.calculateTrip(start, finish)));
        } catch (TripPlanningException e) {
            log.warn("Trip {} -> {} rejected ({}): {}", start, finish, e.getReason(), e.getMessage());
            return error(statusFor(e), e.getMessage(), e.getReason().name());
        } catch (Exception e) {
            log.error("Trip {} -> {} failed", start, finish, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error: " + e.getMessage(), "INTERNAL_ERROR");
        }
    }

    static HttpStatus statusFor(TripPlanningException e) {
        switch (e.getReason()) {
            case INVALID_REQUEST:
                return HttpStatus.BAD_REQUEST;
            case ROUTE_UNAVAILABLE:
            case INSUFFICIENT_WAYPOINTS:
                return HttpStatus.NOT_FOUND;
            case NO_STATION_NEAR_ORIGIN:
            case PARTIAL_PLAN:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case STATION_CATALOG_UNAVAILABLE:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message, String reason) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("reason", reason);
        return ResponseEntity.status(status).body(body);
    }
}
