package com.tripAgent.TripOptimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TripOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TripOptimizerApplication.class, args);
    }
}
