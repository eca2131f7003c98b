package com.example.fuel.model;

import lombok.Value;

@Value
public class FuelStop {
    Station station;
    /** Cumulative route distance at which this stop sits. */
    double milesTraveled;
    /** Gallons burnt on the leg that ends at this stop. */
    double fuelGallons;
    double pricePerGallon;
    double cost;
}
