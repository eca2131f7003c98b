package com.example.fuel.model;

import lombok.Value;

import java.util.List;

/**
 * Output of one planner run. {@code truncated} is set when a dead end after the origin cut the plan short.
 */
@Value
public class PlannedStops {
    List<FuelStop> stops;
    boolean truncated;
    List<String> warnings;
}
