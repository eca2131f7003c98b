package com.example.fuel.service;

import com.example.fuel.config.FuelPlanProperties;
import com.example.fuel.model.FuelStop;
import com.example.fuel.util.Rounding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class CostAggregator {

    private final FuelPlanProperties properties;

    /**
     * Sum of stop costs rounded to cents; zero for no stops.
     */
    public double totalCost(List<FuelStop> stops) {
        double total = 0;
        for (FuelStop stop : stops) {
            total += stop.getCost();
        }
        return Rounding.cents(total);
    }

    /**
     * Compares purchased gallons with what the whole route burns. Returns false, and logs a warning,
     * when they differ by more than the configured tolerance.
     */
    public boolean checkGallons(List<FuelStop> stops, double totalDistance) {
        double purchased = 0;
        for (FuelStop stop : stops) {
            purchased += stop.getFuelGallons();
        }
        double needed = totalDistance / properties.getMilesPerGallon();
        if (Math.abs(needed - purchased) > properties.getGallonTolerance()) {
            log.warn("Stops account for {} of the {} gallons the route needs; the last leg is unfuelled or the plan was truncated",
                    String.format("%.2f", purchased), String.format("%.2f", needed));
            return false;
        }
        return true;
    }
}
