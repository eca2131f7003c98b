package com.example.fuel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class FuelRouteApplication {

    public static void main(String[] args) {
        SpringApplication.run(FuelRouteApplication.class, args);
    }
}
