package com.example.fuel.model;

import lombok.Value;

/**
 * A (latitude, longitude) sample point along a route's geometry, in degrees.
 */
@Value
public class Waypoint {
    double lat;
    double lon;
}
