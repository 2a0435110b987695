package com.tripAgent.TripOptimizer.exception;

/**
 * Malformed or contradictory intent. Raised before any source is contacted.
 */
public class InvalidIntentException extends TripOptimizerException {

    public InvalidIntentException(String message) {
        super(message);
    }
}
