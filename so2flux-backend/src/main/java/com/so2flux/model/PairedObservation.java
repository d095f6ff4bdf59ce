package com.so2flux.model;

import java.util.Optional;

/**
 * The geometry resolved for one scan, together with the other-station scan it was paired
 * with, if any.
 */
public class PairedObservation {

    private final ScanFile pairScan;
    private final PlumeGeometry geometry;

    private PairedObservation(ScanFile pairScan, PlumeGeometry geometry) {
        this.pairScan = pairScan;
        this.geometry = geometry;
    }

    public static PairedObservation paired(ScanFile pairScan, PlumeGeometry geometry) {
        return new PairedObservation(pairScan, geometry);
    }

    public static PairedObservation unpaired(PlumeGeometry geometry) {
        return new PairedObservation(null, geometry);
    }

    public Optional<ScanFile> getPairScan() {
        return Optional.ofNullable(pairScan);
    }

    public PlumeGeometry getGeometry() {
        return geometry;
    }
}
