package com.tripAgent.TripOptimizer.exception;

import lombok.Getter;

@Getter
public class SourceUnavailableException extends TripOptimizerException {

    private final String sourceName;

    public SourceUnavailableException(String sourceName, String message, Throwable cause) {
        super("[" + sourceName + "] " + message, cause);
        this.sourceName = sourceName;
    }
}
