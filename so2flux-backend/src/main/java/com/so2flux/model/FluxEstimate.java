package com.so2flux.model;

/**
 * SO2 mass flux through a scan and its one-sigma uncertainty, both in kg/s.
 */
public class FluxEstimate {

    private final double flux;
    private final double fluxError;

    public FluxEstimate(double flux, double fluxError) {
        this.flux = flux;
        this.fluxError = fluxError;
    }

    public double getFlux() {
        return flux;
    }

    public double getFluxError() {
        return fluxError;
    }

    @Override
    public String toString() {
        return "FluxEstimate{flux=" + flux + ", fluxError=" + fluxError + '}';
    }
}
