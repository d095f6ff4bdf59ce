package com.so2flux.config;

import com.so2flux.model.GeoLocation;
import com.so2flux.model.Station;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the flux retrieval, bound from the {@code flux.*} keys of the application
 * configuration.
 */
@ConfigurationProperties(prefix = "flux")
public class FluxProperties {

    private String resultsRoot = "Results";

    // If set, the analysis for this date runs once at startup
    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate analysisDate;
    private boolean reanalysis = false;

    private GeoLocation vent = new GeoLocation();
    private double defaultAltitude = 1000; // m a.s.l.
    private double defaultAzimuth = 0; // degrees from north
    private double windSpeed = 10; // m/s
    private double scanPairTime = 10; // minutes
    private boolean scanPairFlag = true;

    private FilterSettings filter = new FilterSettings();
    private Realtime realtime = new Realtime();
    private List<Station> stations = new ArrayList<>();

    public String getResultsRoot() {
        return resultsRoot;
    }

    public void setResultsRoot(String resultsRoot) {
        this.resultsRoot = resultsRoot;
    }

    public LocalDate getAnalysisDate() {
        return analysisDate;
    }

    public void setAnalysisDate(LocalDate analysisDate) {
        this.analysisDate = analysisDate;
    }

    public boolean isReanalysis() {
        return reanalysis;
    }

    public void setReanalysis(boolean reanalysis) {
        this.reanalysis = reanalysis;
    }

    public GeoLocation getVent() {
        return vent;
    }

    public void setVent(GeoLocation vent) {
        this.vent = vent;
    }

    public double getDefaultAltitude() {
        return defaultAltitude;
    }

    public void setDefaultAltitude(double defaultAltitude) {
        this.defaultAltitude = defaultAltitude;
    }

    public double getDefaultAzimuth() {
        return defaultAzimuth;
    }

    public void setDefaultAzimuth(double defaultAzimuth) {
        this.defaultAzimuth = defaultAzimuth;
    }

    public double getWindSpeed() {
        return windSpeed;
    }

    public void setWindSpeed(double windSpeed) {
        this.windSpeed = windSpeed;
    }

    public double getScanPairTime() {
        return scanPairTime;
    }

    public void setScanPairTime(double scanPairTime) {
        this.scanPairTime = scanPairTime;
    }

    /** @return the pairing window as a duration */
    public Duration getScanPairWindow() {
        return Duration.ofMillis(Math.round(scanPairTime * 60_000));
    }

    public boolean isScanPairFlag() {
        return scanPairFlag;
    }

    public void setScanPairFlag(boolean scanPairFlag) {
        this.scanPairFlag = scanPairFlag;
    }

    public FilterSettings getFilter() {
        return filter;
    }

    public void setFilter(FilterSettings filter) {
        this.filter = filter;
    }

    public Realtime getRealtime() {
        return realtime;
    }

    public void setRealtime(Realtime realtime) {
        this.realtime = realtime;
    }

    public List<Station> getStations() {
        return stations;
    }

    public void setStations(List<Station> stations) {
        this.stations = stations;
    }

    /**
     * Periodic recalculation of the current day's fluxes.
     */
    public static class Realtime {

        private boolean enabled = false;
        private long intervalMs = 60_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }
    }
}
