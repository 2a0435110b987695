package com.tripAgent.TripOptimizer.model;

import lombok.Value;

import java.util.List;

/**
 * Merged output of one fan-out over every registered source of a kind.
 */
@Value
public class CandidateBatch<C extends Candidate> {
    CandidateKind kind;
    List<C> candidates;
    List<String> succeededSources;
    List<String> degradedSources;

    public boolean isDegraded() {
        return !degradedSources.isEmpty();
    }
}
