package com.example.fuel.service;

import com.example.fuel.exception.RouteUnavailableException;
import com.example.fuel.model.CityState;
import com.example.fuel.model.RouteData;

public interface RoutingProvider {

    /**
     * Driving route between two locations.
     *
     * @throws RouteUnavailableException when no usable route is returned
     */
    RouteData getRoute(CityState origin, CityState destination);
}
