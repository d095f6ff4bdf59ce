package com.so2flux.service.model;

import com.so2flux.model.FluxEstimate;
import com.so2flux.model.GeoLocation;
import com.so2flux.model.Station;

/**
 * Interface defining the conversion of a filtered scan into an SO2 mass flux.
 */
public interface FluxIntegrator {

    /**
     * Integrates the column density across the plume and scales it by the wind speed.
     *
     * @param angles        scan angles of the kept spectra, degrees
     * @param so2           SO2 slant columns, molec/cm2
     * @param so2Err        SO2 slant column errors, molec/cm2
     * @param station       the scanning station
     * @param vent          vent location
     * @param windSpeed     m/s
     * @param plumeAltitude m a.s.l.
     * @param plumeAzimuth  degrees from north
     * @return flux and flux error in kg/s
     * @throws IllegalArgumentException if no samples are given
     * @throws FluxCalculationException if the geometry does not allow an integration
     */
    FluxEstimate integrate(double[] angles, double[] so2, double[] so2Err, Station station, GeoLocation vent,
            double windSpeed, double plumeAltitude, double plumeAzimuth);
}
