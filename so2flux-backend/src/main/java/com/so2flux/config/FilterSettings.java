package com.so2flux.config;

/**
 * Quality bounds and smoothing parameters of the scan quality gate.
 */
public class FilterSettings {

    private double minScd = -1e17; // molec/cm2
    private double maxScd = 1e20;
    private double minInt = 500; // counts
    private double maxInt = 60000;
    private double plumeScd = 1e17;
    private double goodScanLim = 0.2; // max fraction of rejected spectra
    private int smoothingWindow = 11; // odd
    private int smoothingOrder = 3;

    public FilterSettings() {
        // Default constructor for configuration binding
    }

    public double getMinScd() {
        return minScd;
    }

    public void setMinScd(double minScd) {
        this.minScd = minScd;
    }

    public double getMaxScd() {
        return maxScd;
    }

    public void setMaxScd(double maxScd) {
        this.maxScd = maxScd;
    }

    public double getMinInt() {
        return minInt;
    }

    public void setMinInt(double minInt) {
        this.minInt = minInt;
    }

    public double getMaxInt() {
        return maxInt;
    }

    public void setMaxInt(double maxInt) {
        this.maxInt = maxInt;
    }

    public double getPlumeScd() {
        return plumeScd;
    }

    public void setPlumeScd(double plumeScd) {
        this.plumeScd = plumeScd;
    }

    public double getGoodScanLim() {
        return goodScanLim;
    }

    public void setGoodScanLim(double goodScanLim) {
        this.goodScanLim = goodScanLim;
    }

    public int getSmoothingWindow() {
        return smoothingWindow;
    }

    public void setSmoothingWindow(int smoothingWindow) {
        this.smoothingWindow = smoothingWindow;
    }

    public int getSmoothingOrder() {
        return smoothingOrder;
    }

    public void setSmoothingOrder(int smoothingOrder) {
        this.smoothingOrder = smoothingOrder;
    }
}
