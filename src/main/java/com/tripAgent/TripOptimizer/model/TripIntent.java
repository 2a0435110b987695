package com.tripAgent.TripOptimizer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * Structured travel request handed to the optimizer. Free-text parsing happens upstream.
 */
@Value
@Builder(toBuilder = true)
public class TripIntent {
    String destination;
    String origin;
    String pointOfInterest;
    LocalDate startDate;
    LocalDate endDate;
    int travelers;

    @Builder.Default
    TravelPreferences preferences = TravelPreferences.defaults();

    /** Loyalty program code to points balance. */
    @Singular
    Map<String, Long> loyaltyBalances;
}
