package com.tripAgent.TripOptimizer.exception;

public class ExternalApiException extends TripOptimizerException {

    public ExternalApiException(String message) {
        super(message);
    }

    public ExternalApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
