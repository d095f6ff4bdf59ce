package com.so2flux.service.model.impl;

import com.so2flux.config.FluxProperties;
import com.so2flux.model.GeoLocation;
import com.so2flux.model.PlumeGeometry;
import com.so2flux.model.Station;
import com.so2flux.service.model.PlumeGeometryEstimator;
import com.so2flux.service.model.impl.geometry.LocalProjection;
import com.so2flux.service.model.impl.geometry.ScanPlane;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Triangulates the plume from two stations, modelling it as a horizontal straight line
 * that leaves the vent at an unknown altitude {@code h}.
 *
 * <p>Each station's peak ray meets altitude {@code h} at a point {@code P_i = A_i + h B_i}
 * (vent at the origin). The plume line passes through the vent and both points, so
 * {@code cross(P_1, P_2) = 0}, a polynomial in {@code h} of degree two at most. A root is
 * accepted when it lies above both stations and puts both points on the same side of the
 * vent; of several, the one closest to the default altitude wins.
 */
@Service
public class TriangulationGeometryEstimator implements PlumeGeometryEstimator {

    private static final Logger logger = LoggerFactory.getLogger(TriangulationGeometryEstimator.class);

    // Below these the quadratic/linear terms are treated as vanishing
    private static final double QUADRATIC_TOLERANCE = 1e-9;
    private static final double LINEAR_TOLERANCE = 1e-6;

    private final double defaultAzimuth;

    @Autowired
    public TriangulationGeometryEstimator(FluxProperties properties) {
        this(properties.getDefaultAzimuth());
    }

    public TriangulationGeometryEstimator(double defaultAzimuth) {
        this.defaultAzimuth = defaultAzimuth;
    }

    @Override
    public PlumeGeometry estimate(double ownPeakAngle, double pairedPeakAngle, Station ownStation,
            Station pairedStation, GeoLocation vent, double defaultAltitude) {
        PlumeGeometry fallback = PlumeGeometry.defaults(defaultAltitude, defaultAzimuth);

        ScanPlane ownPlane = new ScanPlane(ownStation);
        ScanPlane pairedPlane = new ScanPlane(pairedStation);
        if (!ownPlane.looksUpward(ownPeakAngle) || !pairedPlane.looksUpward(pairedPeakAngle)) {
            logger.debug("Peak angles {} / {} do not look upward, using default geometry", ownPeakAngle,
                    pairedPeakAngle);
            return fallback;
        }

        LocalProjection projection = new LocalProjection(vent);
        Coordinate s1 = projection.toLocal(ownStation.getPosition());
        Coordinate s2 = projection.toLocal(pairedStation.getPosition());

        Vector2D b1 = ownPlane.offsetPerMetre(ownPeakAngle);
        Vector2D b2 = pairedPlane.offsetPerMetre(pairedPeakAngle);
        Vector2D a1 = Vector2D.create(s1.x, s1.y).subtract(b1.multiply(s1.getZ()));
        Vector2D a2 = Vector2D.create(s2.x, s2.y).subtract(b2.multiply(s2.getZ()));

        double c2 = cross(b1, b2);
        double c1 = cross(a1, b2) + cross(b1, a2);
        double c0 = cross(a1, a2);

        Double best = null;
        for (double h : roots(c2, c1, c0)) {
            if (!isValid(h, a1, b1, a2, b2, s1.getZ(), s2.getZ())) continue;
            if (best == null || Math.abs(h - defaultAltitude) < Math.abs(best - defaultAltitude)) {
                best = h;
            }
        }
        if (best == null) {
            logger.debug("No valid plume altitude from stations {} and {}, using default geometry",
                    ownStation.getName(), pairedStation.getName());
            return fallback;
        }

        Vector2D p1 = a1.add(b1.multiply(best));
        Vector2D p2 = a2.add(b2.multiply(best));
        Vector2D mid = p1.add(p2).divide(2);
        double azimuth = LocalProjection.bearing(new Coordinate(0, 0), new Coordinate(mid.getX(), mid.getY()));

        logger.debug("Triangulated plume from {} and {}: altitude {} m, azimuth {} deg", ownStation.getName(),
                pairedStation.getName(), String.format("%.1f", best), String.format("%.1f", azimuth));
        return PlumeGeometry.triangulated(best, azimuth);
    }

    private static boolean isValid(double h, Vector2D a1, Vector2D b1, Vector2D a2, Vector2D b2, double z1,
            double z2) {
        if (!Double.isFinite(h) || h <= z1 || h <= z2) {
            return false;
        }
        Vector2D p1 = a1.add(b1.multiply(h));
        Vector2D p2 = a2.add(b2.multiply(h));
        return p1.dot(p2) > 0;
    }

    /** Real roots of {@code c2 h^2 + c1 h + c0 = 0}. */
    static List<Double> roots(double c2, double c1, double c0) {
        List<Double> roots = new ArrayList<>();
        if (Math.abs(c2) < QUADRATIC_TOLERANCE) {
            if (Math.abs(c1) >= LINEAR_TOLERANCE) {
                roots.add(-c0 / c1);
            }
            return roots;
        }
        double disc = c1 * c1 - 4 * c2 * c0;
        if (disc < 0) {
            return roots;
        }
        // Numerically stable form
        double q = -0.5 * (c1 + Math.copySign(Math.sqrt(disc), c1));
        roots.add(q / c2);
        if (q != 0) {
            roots.add(c0 / q);
        }
        return roots;
    }

    private static double cross(Vector2D u, Vector2D v) {
        return u.getX() * v.getY() - u.getY() * v.getX();
    }
}
