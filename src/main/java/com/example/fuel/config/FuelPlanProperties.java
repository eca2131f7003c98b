package com.example.fuel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Vehicle and planner constants, bound from {@code fuel.*}.
 */
@Data
@ConfigurationProperties(prefix = "fuel")
public class FuelPlanProperties {

    /**
     * Maximum miles travelable on a full tank. No leg may exceed it.
     */
    private double vehicleRangeMiles = 500;

    private double milesPerGallon = 10;

    /**
     * Price used when a station record carries no retail price.
     */
    private double fallbackPricePerGallon = 3.50;

    /**
     * Stations with coordinates further than this from every waypoint are dropped before planning.
     */
    private double prefilterProximityMiles = 100;

    /**
     * When true a mid-route dead end fails the request instead of returning the stops found so far.
     */
    private boolean failOnPartialPlan = false;

    /**
     * Allowed difference, in gallons, between purchased fuel and the fuel the whole route needs.
     */
    private double gallonTolerance = 0.5;

    private Stations stations = new Stations();

    @Data
    public static class Stations {
        /** Spring resource location of the retailer price CSV. */
        private String csvPath = "classpath:fuel-prices.csv";
    }
}
