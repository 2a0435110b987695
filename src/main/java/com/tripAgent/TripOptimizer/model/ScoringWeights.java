package com.tripAgent.TripOptimizer.model;

import lombok.Value;

@Value
public class ScoringWeights {
    double cost;
    double flight;
    double hotel;
    double duration;
}
