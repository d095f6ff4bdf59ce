package com.so2flux.service.model.impl.geometry;

import com.so2flux.model.Station;
import org.locationtech.jts.algorithm.Angle;
import org.locationtech.jts.math.Vector2D;

/**
 * Viewing geometry of a station's scan plane in the local east/north frame.
 *
 * <p>A ray at scan angle {@code theta} that climbs {@code dz} metres lands at horizontal
 * offset {@code dz * (tan(theta) / cos(tilt) * direction + tan(tilt) * normal)}, where
 * {@code direction} points along the station azimuth and {@code normal} is
 * {@code direction} turned 90 degrees clockwise.
 */
public class ScanPlane {

    private final double azimuth;
    private final double tilt;
    private final Vector2D direction;
    private final Vector2D normal;

    public ScanPlane(Station station) {
        this.azimuth = station.getAzimuth();
        this.tilt = Angle.toRadians(station.getTilt());
        double az = Angle.toRadians(azimuth);
        this.direction = Vector2D.create(Math.sin(az), Math.cos(az));
        this.normal = Vector2D.create(Math.cos(az), -Math.sin(az));
    }

    public double getAzimuth() {
        return azimuth;
    }

    public Vector2D getDirection() {
        return direction;
    }

    /** @return true if a ray at this scan angle climbs, i.e. can reach a plume overhead */
    public boolean looksUpward(double scanAngle) {
        return Math.abs(scanAngle) < 90.0 && Math.cos(tilt) > 0;
    }

    /** @return distance along the plane direction per metre of climb */
    public double alongPlanePerMetre(double scanAngle) {
        return Math.tan(Angle.toRadians(scanAngle)) / Math.cos(tilt);
    }

    /** @return horizontal offset of the ray per metre of climb */
    public Vector2D offsetPerMetre(double scanAngle) {
        return direction.multiply(alongPlanePerMetre(scanAngle)).add(normal.multiply(Math.tan(tilt)));
    }

    /** @return factor converting a slant column at this angle to a vertical column */
    public double verticalColumnFactor(double scanAngle) {
        return Math.cos(Angle.toRadians(scanAngle)) * Math.cos(tilt);
    }
}
