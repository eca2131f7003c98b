package com.example.fuel.controller;

import com.example.fuel.exception.InvalidTripRequestException;
import com.example.fuel.exception.NoStationNearOriginException;
import com.example.fuel.exception.PartialPlanException;
import com.example.fuel.exception.RouteUnavailableException;
import com.example.fuel.exception.StationCatalogException;
import com.example.fuel.model.FuelStop;
import com.example.fuel.model.Station;
import com.example.fuel.model.TripPlan;
import com.example.fuel.model.TripResponse;
import com.example.fuel.service.TripService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TripController.class)
class TripControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TripService tripService;

    @Test
    void testCalculateTrip() throws Exception {
        Station station = Station.builder()
                .name("TA OKLAHOMA CITY")
                .address("I-40, EXIT 140")
                .city("oklahoma city")
                .state("OK")
                .pricePerGallon(3.079)
                .build();
        TripPlan plan = TripPlan.builder()
                .totalDistanceMiles(612.4)
                .estimatedTravelTime("9 hours 5 mins")
                .stops(List.of(new FuelStop(station, 412.347, 41.2345, 3.079, 126.9610255)))
                .totalFuelCost(126.96)
                .warnings(List.of())
                .build();
        when(tripService.calculateTrip("Tulsa, OK", "Amarillo, TX")).thenReturn(plan);

        mockMvc.perform(get("/api/calculate_trip").param("start", "Tulsa, OK").param("finish", "Amarillo, TX"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_distance_miles").value(612.4))
                .andExpect(jsonPath("$.estimated_travel_time").value("9 hours 5 mins"))
                .andExpect(jsonPath("$.fuel_stops[0].name").value("TA OKLAHOMA CITY"))
                .andExpect(jsonPath("$.fuel_stops[0].city").value("Oklahoma City"))
                .andExpect(jsonPath("$.fuel_stops[0].state").value("OK"))
                .andExpect(jsonPath("$.fuel_stops[0].fuel_price_per_gallon").value(3.08))
                .andExpect(jsonPath("$.fuel_stops[0].fuel_needed_gallons").value(41.23))
                .andExpect(jsonPath("$.fuel_stops[0].total_cost").value(126.96))
                .andExpect(jsonPath("$.fuel_stops[0].miles_traveled").value(412.35))
                .andExpect(jsonPath("$.total_fuel_cost").value(126.96))
                .andExpect(jsonPath("$.warnings").isEmpty());
    }

    @Test
    void testCalculateTrip_invalidRequest() throws Exception {
        when(tripService.calculateTrip(null, "Amarillo, TX"))
                .thenThrow(new InvalidTripRequestException("Missing 'start' parameter"));

        mockMvc.perform(get("/api/calculate_trip").param("finish", "Amarillo, TX"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing 'start' parameter"))
                .andExpect(jsonPath("$.reason").value("INVALID_REQUEST"));
    }

    @Test
    void testCalculateTrip_noRoute() throws Exception {
        when(tripService.calculateTrip("Honolulu, HI", "Tulsa, OK"))
                .thenThrow(new RouteUnavailableException("No route found from Honolulu, HI to Tulsa, OK"));

        mockMvc.perform(get("/api/calculate_trip").param("start", "Honolulu, HI").param("finish", "Tulsa, OK"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.reason").value("ROUTE_UNAVAILABLE"));
    }

    @Test
    void testCalculateTrip_noStationNearOrigin() throws Exception {
        when(tripService.calculateTrip("Tulsa, OK", "Amarillo, TX"))
                .thenThrow(new NoStationNearOriginException("No fuel station found within 500 miles of the origin"));

        mockMvc.perform(get("/api/calculate_trip").param("start", "Tulsa, OK").param("finish", "Amarillo, TX"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.reason").value("NO_STATION_NEAR_ORIGIN"));
    }

    @Test
    void testCalculateTrip_catalogUnavailable() throws Exception {
        when(tripService.calculateTrip("Tulsa, OK", "Amarillo, TX"))
                .thenThrow(new StationCatalogException("Station CSV not found"));

        mockMvc.perform(get("/api/calculate_trip").param("start", "Tulsa, OK").param("finish", "Amarillo, TX"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.reason").value("STATION_CATALOG_UNAVAILABLE"));
    }

    @Test
    void testCalculateTrip_partialPlanRejected() throws Exception {
        when(tripService.calculateTrip("Tulsa, OK", "Amarillo, TX"))
                .thenThrow(new PartialPlanException("No fuel station found between mile 300.00 and mile 750.00"));

        mockMvc.perform(get("/api/calculate_trip").param("start", "Tulsa, OK").param("finish", "Amarillo, TX"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.reason").value("PARTIAL_PLAN"));
    }

    @Test
    void testCalculateTrip_unexpectedFailure() throws Exception {
        when(tripService.calculateTrip("Tulsa, OK", "Amarillo, TX")).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(get("/api/calculate_trip").param("start", "Tulsa, OK").param("finish", "Amarillo, TX"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Error: boom"));
    }

    @Test
    void testLocations() throws Exception {
        when(tripService.availableLocations()).thenReturn(List.of(
                new TripResponse.Location("Big Cabin", "OK"),
                new TripResponse.Location("Amarillo", "TX")));

        mockMvc.perform(get("/api/locations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].city").value("Big Cabin"))
                .andExpect(jsonPath("$[1].state").value("TX"));

        verify(tripService).availableLocations();
    }
}
