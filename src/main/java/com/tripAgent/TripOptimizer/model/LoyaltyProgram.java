package com.tripAgent.TripOptimizer.model;

import lombok.Value;

@Value
public class LoyaltyProgram {
    String code;
    /** Cash value of a single point. */
    double pointValue;
    /** Points needed per unit of cash price. */
    double conversionRate;
}
