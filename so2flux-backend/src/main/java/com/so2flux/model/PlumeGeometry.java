package com.so2flux.model;

/**
 * Plume altitude (m a.s.l.) and azimuth (degrees from north, the direction the plume
 * travels away from the vent), either triangulated from a scan pair or filled from the
 * configured defaults.
 */
public class PlumeGeometry {

    public enum Source {
        TRIANGULATED,
        DEFAULT
    }

    private final double altitude;
    private final double azimuth;
    private final Source source;

    private PlumeGeometry(double altitude, double azimuth, Source source) {
        this.altitude = altitude;
        this.azimuth = azimuth;
        this.source = source;
    }

    public static PlumeGeometry triangulated(double altitude, double azimuth) {
        return new PlumeGeometry(altitude, azimuth, Source.TRIANGULATED);
    }

    public static PlumeGeometry defaults(double altitude, double azimuth) {
        return new PlumeGeometry(altitude, azimuth, Source.DEFAULT);
    }

    public double getAltitude() {
        return altitude;
    }

    public double getAzimuth() {
        return azimuth;
    }

    public Source getSource() {
        return source;
    }

    public boolean isTriangulated() {
        return source == Source.TRIANGULATED;
    }

    @Override
    public String toString() {
        return "PlumeGeometry{" +
                "altitude=" + altitude +
                ", azimuth=" + azimuth +
                ", source=" + source +
                '}';
    }
}
