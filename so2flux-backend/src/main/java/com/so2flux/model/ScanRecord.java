package com.so2flux.model;

import java.time.LocalDateTime;

/**
 * One completed sweep of a station. Samples are held as parallel arrays in acquisition
 * order, which is not necessarily monotonic in angle.
 */
public class ScanRecord {

    private final String fileName;
    private final LocalDateTime startTime;
    private final double[] angles; // degrees, 0 = zenith
    private final double[] so2; // molec/cm2
    private final double[] so2Err;
    private final double[] intensity;

    public ScanRecord(String fileName, LocalDateTime startTime, double[] angles, double[] so2, double[] so2Err,
            double[] intensity) {
        int n = angles.length;
        if (so2.length != n || so2Err.length != n || intensity.length != n) {
            throw new IllegalArgumentException("Sample arrays of scan " + fileName + " differ in length");
        }
        this.fileName = fileName;
        this.startTime = startTime;
        this.angles = angles.clone();
        this.so2 = so2.clone();
        this.so2Err = so2Err.clone();
        this.intensity = intensity.clone();
    }

    public String getFileName() {
        return fileName;
    }

    public LocalDateTime getStartTime() {
        return startTime;
    }

    public int size() {
        return angles.length;
    }

    public double getAngle(int i) {
        return angles[i];
    }

    public double getSo2(int i) {
        return so2[i];
    }

    public double getSo2Err(int i) {
        return so2Err[i];
    }

    public double getIntensity(int i) {
        return intensity[i];
    }
}
