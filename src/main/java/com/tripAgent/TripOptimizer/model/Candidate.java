package com.tripAgent.TripOptimizer.model;

/**
 * An offer returned by a single source before it is combined into a package.
 */
public interface Candidate {
    CandidateKind getKind();
    String getSource();
    String getBookingReference();
}
