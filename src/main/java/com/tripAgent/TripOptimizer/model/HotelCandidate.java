package com.tripAgent.TripOptimizer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class HotelCandidate implements Candidate {
    @NonNull String name;
    double costPerNight;
    double distanceFromPoiKm;
    boolean familyFriendly;
    Double rating;
    @NonNull String source;
    String bookingReference;

    @Override
    public CandidateKind getKind() {
        return CandidateKind.HOTEL;
    }
}
