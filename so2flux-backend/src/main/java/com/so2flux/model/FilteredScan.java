package com.so2flux.model;

import java.util.Arrays;

/**
 * A {@link ScanRecord} seen through the quality gate: a per-sample keep mask, the verdict
 * and, for analyzable scans only, the plume-centre (peak) angle.
 */
public class FilteredScan {

    private final String fileName;
    private final ScanRecord scan;
    private final boolean[] keepMask;
    private final ScanVerdict verdict;
    private final Double peakAngle;

    private FilteredScan(String fileName, ScanRecord scan, boolean[] keepMask, ScanVerdict verdict,
            Double peakAngle) {
        this.fileName = fileName;
        this.scan = scan;
        this.keepMask = keepMask;
        this.verdict = verdict;
        this.peakAngle = peakAngle;
    }

    public static FilteredScan analyzable(ScanRecord scan, boolean[] keepMask, double peakAngle) {
        return new FilteredScan(scan.getFileName(), scan, keepMask.clone(), ScanVerdict.ANALYZABLE, peakAngle);
    }

    public static FilteredScan rejected(ScanRecord scan, boolean[] keepMask, ScanVerdict verdict) {
        if (verdict == ScanVerdict.ANALYZABLE) {
            throw new IllegalArgumentException("A rejected scan needs a rejection verdict");
        }
        return new FilteredScan(scan.getFileName(), scan, keepMask.clone(), verdict, null);
    }

    /** A scan whose file could not be parsed; it has no samples. */
    public static FilteredScan unreadable(String fileName) {
        return new FilteredScan(fileName, null, new boolean[0], ScanVerdict.REJECTED_UNREADABLE, null);
    }

    public String getFileName() {
        return fileName;
    }

    public ScanVerdict getVerdict() {
        return verdict;
    }

    public boolean isAnalyzable() {
        return verdict == ScanVerdict.ANALYZABLE;
    }

    /**
     * @return the peak angle in degrees
     * @throws IllegalStateException if the scan was rejected
     */
    public double getPeakAngle() {
        if (peakAngle == null) {
            throw new IllegalStateException("Scan " + fileName + " has no peak angle: " + verdict.getDescription());
        }
        return peakAngle;
    }

    public boolean isKept(int i) {
        return keepMask[i];
    }

    public int getKeptCount() {
        int count = 0;
        for (boolean keep : keepMask) {
            if (keep) count++;
        }
        return count;
    }

    public double[] getKeptAngles() {
        return kept(Sample.ANGLE);
    }

    public double[] getKeptSo2() {
        return kept(Sample.SO2);
    }

    public double[] getKeptSo2Err() {
        return kept(Sample.SO2_ERR);
    }

    private enum Sample {
        ANGLE, SO2, SO2_ERR
    }

    private double[] kept(Sample sample) {
        double[] values = new double[keepMask.length];
        int n = 0;
        for (int i = 0; i < keepMask.length; i++) {
            if (!keepMask[i]) continue;
            values[n++] = switch (sample) {
                case ANGLE -> scan.getAngle(i);
                case SO2 -> scan.getSo2(i);
                case SO2_ERR -> scan.getSo2Err(i);
            };
        }
        return Arrays.copyOf(values, n);
    }
}
