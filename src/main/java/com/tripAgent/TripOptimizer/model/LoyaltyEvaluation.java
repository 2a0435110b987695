package com.tripAgent.TripOptimizer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LoyaltyEvaluation {
    String programCode;
    LoyaltyRecommendation recommendation;
    long pointsRequired;
    long pointsBalance;
    double pointsCostInCash;
    double savings;
    /** Null when no points are required. */
    Double effectiveValuePerPoint;
    String comment;

    public boolean isApplicable() {
        return effectiveValuePerPoint != null;
    }
}
