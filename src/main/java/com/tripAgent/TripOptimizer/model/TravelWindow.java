package com.tripAgent.TripOptimizer.model;

import lombok.Value;

import java.time.LocalDate;

@Value
public class TravelWindow {
    LocalDate startDate;
    LocalDate endDate;
    int duration;

    public static TravelWindow of(LocalDate startDate, int duration) {
        return new TravelWindow(startDate, startDate.plusDays(duration), duration);
    }
}
