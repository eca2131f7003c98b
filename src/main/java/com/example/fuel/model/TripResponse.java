package com.example.fuel.model;

import com.example.fuel.util.Rounding;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TripResponse {
    @JsonProperty("total_distance_miles")
    private double totalDistanceMiles;
    @JsonProperty("estimated_travel_time")
    private String estimatedTravelTime;
    @JsonProperty("fuel_stops")
    private List<Stop> fuelStops = new ArrayList<>();
    @JsonProperty("total_fuel_cost")
    private double totalFuelCost;
    private List<String> warnings = new ArrayList<>();

    public static TripResponse from(TripPlan plan) {
        List<Stop> stops = new ArrayList<>();
        for (FuelStop fuelStop : plan.getStops()) {
            stops.add(Stop.from(fuelStop));
        }
        return new TripResponse(plan.getTotalDistanceMiles(), plan.getEstimatedTravelTime(), stops,
                plan.getTotalFuelCost(), new ArrayList<>(plan.getWarnings()));
    }

    @Data
    @NoArgsConstructor
    public static class Stop {
        private String name;
        private String address;
        private String city; // title-cased for display
        private String state;
        @JsonProperty("fuel_price_per_gallon")
        private double fuelPricePerGallon;
        @JsonProperty("fuel_needed_gallons")
        private double fuelNeededGallons;
        @JsonProperty("total_cost")
        private double totalCost;
        @JsonProperty("miles_traveled")
        private double milesTraveled;

        static Stop from(FuelStop fuelStop) {
            Station station = fuelStop.getStation();
            Stop stop = new Stop();
            stop.setName(station.getName());
            stop.setAddress(station.getAddress());
            stop.setCity(CityState.titleCase(station.getCity()));
            stop.setState(station.getState());
            stop.setFuelPricePerGallon(Rounding.cents(fuelStop.getPricePerGallon()));
            stop.setFuelNeededGallons(Rounding.cents(fuelStop.getFuelGallons()));
            stop.setTotalCost(Rounding.cents(fuelStop.getCost()));
            stop.setMilesTraveled(Rounding.cents(fuelStop.getMilesTraveled()));
            return stop;
        }
    }

    @Data
    @AllArgsConstructor
    public static class Location {
        private String city;
        private String state;
    }
}
