package com.tripAgent.TripOptimizer.exception;

public class UnknownLoyaltyProgramException extends TripOptimizerException {

    public UnknownLoyaltyProgramException(String programCode) {
        super("Unknown loyalty program: " + programCode);
    }
}
