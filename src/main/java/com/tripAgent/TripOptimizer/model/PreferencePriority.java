package com.tripAgent.TripOptimizer.model;

/**
 * Which criterion dominates the score. Resolved once per intent; only one flag is honored.
 */
public enum PreferencePriority {
    BALANCED(new ScoringWeights(0.40, 0.30, 0.25, 0.05)),
    COST(new ScoringWeights(0.60, 0.20, 0.15, 0.05)),
    FLIGHT_TIME(new ScoringWeights(0.25, 0.50, 0.20, 0.05)),
    HOTEL_QUALITY(new ScoringWeights(0.25, 0.20, 0.50, 0.05));

    private final ScoringWeights weights;

    PreferencePriority(ScoringWeights weights) {
        this.weights = weights;
    }

    public ScoringWeights weights() {
        return weights;
    }

    public static PreferencePriority resolve(TravelPreferences preferences) {
        if (preferences == null) {
            return BALANCED;
        }
        if (preferences.isPrioritizeCost()) {
            return COST;
        }
        if (preferences.isPrioritizeFlightTime()) {
            return FLIGHT_TIME;
        }
        if (preferences.isPrioritizeHotelQuality()) {
            return HOTEL_QUALITY;
        }
        return BALANCED;
    }
}
