package com.so2flux.model;

/**
 * A fixed scanning spectrometer station.
 *
 * <p>The scanner sweeps a fan of viewing angles in a single plane. A scan angle of 0 looks
 * at the zenith and positive angles look towards {@code azimuth} (degrees from north).
 * {@code tilt} is the inclination of the scan plane from vertical, positive towards
 * {@code azimuth + 90}.
 */
public class Station {

    private String name;
    private double latitude;
    private double longitude;
    private double elevation; // m a.s.l.
    private double azimuth; // degrees from north
    private double tilt; // degrees from vertical
    private boolean analysisEnabled = true;

    public Station() {
        // Default constructor for configuration binding
    }

    public Station(String name, double latitude, double longitude, double elevation, double azimuth, double tilt) {
        this.name = name;
        this.latitude = latitude;
        this.longitude = longitude;
        this.elevation = elevation;
        this.azimuth = azimuth;
        this.tilt = tilt;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public double getLatitude() {
        return latitude;
    }

    public void setLatitude(double latitude) {
        this.latitude = latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public void setLongitude(double longitude) {
        this.longitude = longitude;
    }

    public double getElevation() {
        return elevation;
    }

    public void setElevation(double elevation) {
        this.elevation = elevation;
    }

    public double getAzimuth() {
        return azimuth;
    }

    public void setAzimuth(double azimuth) {
        this.azimuth = azimuth;
    }

    public double getTilt() {
        return tilt;
    }

    public void setTilt(double tilt) {
        this.tilt = tilt;
    }

    public boolean isAnalysisEnabled() {
        return analysisEnabled;
    }

    public void setAnalysisEnabled(boolean analysisEnabled) {
        this.analysisEnabled = analysisEnabled;
    }

    public GeoLocation getPosition() {
        return new GeoLocation(latitude, longitude, elevation);
    }

    @Override
    public String toString() {
        return "Station{" +
                "name='" + name + '\'' +
                ", latitude=" + latitude +
                ", longitude=" + longitude +
                ", elevation=" + elevation +
                ", azimuth=" + azimuth +
                ", tilt=" + tilt +
                ", analysisEnabled=" + analysisEnabled +
                '}';
    }
}
