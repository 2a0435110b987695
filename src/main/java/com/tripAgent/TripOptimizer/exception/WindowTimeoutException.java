package com.tripAgent.TripOptimizer.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * The fan-out of one window ran past {@code optimizer.window-timeout}. Its source tasks have been cancelled.
 */
@Getter
public class WindowTimeoutException extends TripOptimizerException {

    private final Duration timeout;

    public WindowTimeoutException(String message, Duration timeout) {
        super(message);
        this.timeout = timeout;
    }
}
