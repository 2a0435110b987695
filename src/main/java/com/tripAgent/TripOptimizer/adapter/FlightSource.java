package com.tripAgent.TripOptimizer.adapter;

import com.tripAgent.TripOptimizer.model.CandidateKind;
import com.tripAgent.TripOptimizer.model.FlightCandidate;

public interface FlightSource extends CandidateSource<FlightCandidate> {

    @Override
    default CandidateKind getKind() {
        return CandidateKind.FLIGHT;
    }
}
