package com.lpradar.valuation;

/**
 * The simulated fee collection failed. Callers may show fees as unknown instead.
 */
public class FeeSimulationException extends RuntimeException {

    public FeeSimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
