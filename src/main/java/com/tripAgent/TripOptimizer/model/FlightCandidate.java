package com.tripAgent.TripOptimizer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class FlightCandidate implements Candidate {
    @NonNull String airline;
    String flightNumber;
    @NonNull LocalDateTime departureTime;
    @NonNull LocalDateTime arrivalTime;
    double cost; // per traveler
    @NonNull String source;
    String bookingReference;

    @Override
    public CandidateKind getKind() {
        return CandidateKind.FLIGHT;
    }

    public int getDepartureHour() {
        return departureTime.getHour();
    }
}
