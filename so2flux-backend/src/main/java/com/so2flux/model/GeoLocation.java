package com.so2flux.model;

/**
 * A geographic point: latitude and longitude in decimal degrees, elevation in metres
 * above sea level.
 */
public class GeoLocation {

    private double latitude;
    private double longitude;
    private double elevation;

    public GeoLocation() {
        // Default constructor for configuration binding
    }

    public GeoLocation(double latitude, double longitude, double elevation) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.elevation = elevation;
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

    @Override
    public String toString() {
        return "GeoLocation{" +
                "latitude=" + latitude +
                ", longitude=" + longitude +
                ", elevation=" + elevation +
                '}';
    }
}
