package com.tripAgent.TripOptimizer.adapter;

import com.tripAgent.TripOptimizer.model.CandidateKind;
import com.tripAgent.TripOptimizer.model.HotelCandidate;

public interface HotelSource extends CandidateSource<HotelCandidate> {

    @Override
    default CandidateKind getKind() {
        return CandidateKind.HOTEL;
    }
}
