package com.so2flux.service.model.impl.geometry;

import com.so2flux.model.GeoLocation;
import org.locationtech.jts.algorithm.Angle;
import org.locationtech.jts.geom.Coordinate;

/**
 * Equirectangular projection into a local frame centred on a reference point:
 * x east, y north, both in metres, z the elevation. Adequate over the few kilometres that
 * separate the stations from the vent.
 */
public class LocalProjection {

    /** Mean earth radius in metres. */
    public static final double EARTH_RADIUS = 6_371_008.8;

    private final GeoLocation origin;
    private final double cosLat;

    public LocalProjection(GeoLocation origin) {
        this.origin = origin;
        this.cosLat = Math.cos(Angle.toRadians(origin.getLatitude()));
    }

    public Coordinate toLocal(GeoLocation location) {
        double x = EARTH_RADIUS * Angle.toRadians(location.getLongitude() - origin.getLongitude()) * cosLat;
        double y = EARTH_RADIUS * Angle.toRadians(location.getLatitude() - origin.getLatitude());
        return new Coordinate(x, y, location.getElevation());
    }

    /**
     * @return bearing from {@code from} to {@code to} in degrees clockwise from north, in [0, 360)
     */
    public static double bearing(Coordinate from, Coordinate to) {
        double theta = Math.atan2(to.x - from.x, to.y - from.y);
        return Angle.toDegrees(Angle.normalizePositive(theta));
    }
}
