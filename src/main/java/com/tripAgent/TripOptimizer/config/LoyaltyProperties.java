package com.tripAgent.TripOptimizer.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@ConfigurationProperties(prefix = "loyalty")
public class LoyaltyProperties {

    private Map<String, Program> programs = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Program {
        private double pointValue;
        private double conversionRate;
    }
}
