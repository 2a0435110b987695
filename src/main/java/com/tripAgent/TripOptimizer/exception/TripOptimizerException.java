package com.tripAgent.TripOptimizer.exception;

public class TripOptimizerException extends RuntimeException {

    public TripOptimizerException(String message) {
        super(message);
    }

    public TripOptimizerException(String message, Throwable cause) {
        super(message, cause);
    }
}
