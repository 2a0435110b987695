package com.tripAgent.TripOptimizer.model;

public enum CandidateKind {
    FLIGHT,
    HOTEL
}
