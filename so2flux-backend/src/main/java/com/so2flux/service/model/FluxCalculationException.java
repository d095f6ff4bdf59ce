package com.so2flux.service.model;

/**
 * Thrown when a scan passed the quality gate but its flux cannot be computed with the
 * resolved plume geometry.
 */
public class FluxCalculationException extends RuntimeException {

    public FluxCalculationException(String message) {
        super(message);
    }
}
