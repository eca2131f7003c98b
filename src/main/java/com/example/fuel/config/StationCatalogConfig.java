package com.example.fuel.config;

import com.example.fuel.service.StationCatalog;
import com.example.fuel.service.StationCsvLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class StationCatalogConfig {

    /** The full catalog, loaded once at startup and shared by every planning call. */
    @Bean
    public StationCatalog stationCatalog(StationCsvLoader loader, FuelPlanProperties properties,
                                         ResourceLoader resourceLoader) {
        return loader.load(resourceLoader.getResource(properties.getStations().getCsvPath()));
    }
}
