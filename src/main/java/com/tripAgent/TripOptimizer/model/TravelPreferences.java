package com.tripAgent.TripOptimizer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TravelPreferences {
    boolean preferEveningFlights;
    boolean familyFriendlyHotel;
    boolean prioritizeCost;
    boolean prioritizeFlightTime;
    boolean prioritizeHotelQuality;

    @Builder.Default
    int minDuration = 3;

    @Builder.Default
    int maxDuration = 5;

    public static TravelPreferences defaults() {
        return TravelPreferences.builder().build();
    }
}
