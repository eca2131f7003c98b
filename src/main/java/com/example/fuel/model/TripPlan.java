package com.example.fuel.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TripPlan {
    double totalDistanceMiles;
    String estimatedTravelTime;
    List<FuelStop> stops;
    double totalFuelCost;
    List<String> warnings;
}
