package com.tripAgent.TripOptimizer.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Policy constants of the optimization pipeline.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {
    /** Windows kept after enumeration; bounds the combinatorial work per call. */
    private int windowCap = 10;
    /** Candidates kept from each source per call. */
    private int perSourceLimit = 5;
    private Duration sourceTimeout = Duration.ofSeconds(15);
    /** Optional deadline for the whole fan-out of one window. */
    private Duration windowTimeout;
    private int workerPoolSize = 4;
    private int topK = 3;
    private double maxExpectedCost = 2000;
    private double loyaltySavingsThreshold = 10.0;
}
