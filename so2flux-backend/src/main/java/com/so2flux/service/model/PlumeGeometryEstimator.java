package com.so2flux.service.model;

import com.so2flux.model.GeoLocation;
import com.so2flux.model.PlumeGeometry;
import com.so2flux.model.Station;

/**
 * Interface defining how plume altitude and azimuth are derived from a pair of scans.
 */
public interface PlumeGeometryEstimator {

    /**
     * Estimates the plume geometry from the peak angles of two near-simultaneous scans.
     * Never returns a partial result: either both values are triangulated or both are the
     * defaults.
     *
     * @param ownPeakAngle    peak angle of the scan being analysed, degrees
     * @param pairedPeakAngle peak angle of the paired scan, degrees
     * @param ownStation      station of the scan being analysed
     * @param pairedStation   station of the paired scan
     * @param vent            vent location, origin of the plume
     * @param defaultAltitude altitude to fall back to, m a.s.l.
     * @return the triangulated geometry, or the default geometry if the inputs are degenerate
     */
    PlumeGeometry estimate(double ownPeakAngle, double pairedPeakAngle, Station ownStation, Station pairedStation,
            GeoLocation vent, double defaultAltitude);
}
