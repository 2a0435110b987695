package com.tripAgent.TripOptimizer.model;

public enum LoyaltyRecommendation {
    USE_CASH,
    USE_POINTS,
    EITHER
}
