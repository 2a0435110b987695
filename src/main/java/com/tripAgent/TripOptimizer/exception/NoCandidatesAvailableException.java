package com.tripAgent.TripOptimizer.exception;

import com.tripAgent.TripOptimizer.model.CandidateKind;
import lombok.Getter;

@Getter
public class NoCandidatesAvailableException extends TripOptimizerException {

    private final CandidateKind kind;

    public NoCandidatesAvailableException(String message) {
        this(null, message);
    }

    public NoCandidatesAvailableException(CandidateKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
