package com.tripAgent.TripOptimizer.model;

import lombok.Value;

@Value
public class WindowCandidates {
    TravelWindow window;
    CandidateBatch<FlightCandidate> flights;
    CandidateBatch<HotelCandidate> hotels;
}
