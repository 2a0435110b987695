package com.tripAgent.TripOptimizer.adapter;

import com.tripAgent.TripOptimizer.model.Candidate;
import com.tripAgent.TripOptimizer.model.CandidateKind;
import com.tripAgent.TripOptimizer.model.TravelWindow;
import com.tripAgent.TripOptimizer.model.TripIntent;

import java.util.List;

/**
 * A pluggable provider of candidates for one kind. Implementations may block on I/O and may
 * throw; the aggregator isolates each call with its own timeout.
 */
public interface CandidateSource<C extends Candidate> {
    String getSourceName();
    CandidateKind getKind();
    List<C> fetch(TravelWindow window, TripIntent intent);
}
