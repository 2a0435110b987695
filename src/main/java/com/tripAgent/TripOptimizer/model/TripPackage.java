package com.tripAgent.TripOptimizer.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.Objects;

/**
 * One flight, one hotel and one window, priced for the whole party.
 * Only the score and the loyalty analysis are filled in after assembly.
 */
@Getter
@ToString
public class TripPackage {
    private final String id;
    private final TravelWindow window;
    private final FlightCandidate flight;
    private final HotelCandidate hotel;
    private final int travelers;
    private final double totalCost;

    @Setter
    private double totalScore;

    @Setter
    private LoyaltyEvaluation loyaltyEvaluation;

    public TripPackage(String id, TravelWindow window, FlightCandidate flight, HotelCandidate hotel, int travelers) {
        this.id = Objects.requireNonNull(id, "id");
        this.window = Objects.requireNonNull(window, "window");
        this.flight = Objects.requireNonNull(flight, "flight");
        this.hotel = Objects.requireNonNull(hotel, "hotel");
        this.travelers = travelers;
        this.totalCost = totalCost(flight, hotel, window.getDuration(), travelers);
    }

    public static double totalCost(FlightCandidate flight, HotelCandidate hotel, int duration, int travelers) {
        return (flight.getCost() + hotel.getCostPerNight() * duration) * travelers;
    }

    public int getDuration() {
        return window.getDuration();
    }

    public Long getPointsPrice() {
        return loyaltyEvaluation == null ? null : loyaltyEvaluation.getPointsRequired();
    }
}
