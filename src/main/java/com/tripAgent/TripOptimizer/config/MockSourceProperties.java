package com.tripAgent.TripOptimizer.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "sources.mock")
public class MockSourceProperties {
    private boolean enabled = true;
    private long seed = 42L;
}
