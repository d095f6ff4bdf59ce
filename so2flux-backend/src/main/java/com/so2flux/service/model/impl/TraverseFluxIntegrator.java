package com.so2flux.service.model.impl;

import com.so2flux.model.FluxEstimate;
import com.so2flux.model.GeoLocation;
import com.so2flux.model.Station;
import com.so2flux.service.model.FluxCalculationException;
import com.so2flux.service.model.FluxIntegrator;
import com.so2flux.service.model.impl.geometry.LocalProjection;
import com.so2flux.service.model.impl.geometry.ScanPlane;
import org.locationtech.jts.algorithm.Angle;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector2D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Integrates a scan as a traverse across the plume. Each viewing ray is followed up to the
 * plume altitude, giving its position along the scan plane; slant columns are converted to
 * vertical columns and integrated with the trapezoid rule. The wind component normal to
 * the scan plane turns the integrated column into a mass flux.
 */
@Service
public class TraverseFluxIntegrator implements FluxIntegrator {

    private static final Logger logger = LoggerFactory.getLogger(TraverseFluxIntegrator.class);

    private static final double AVOGADRO = 6.02214076e23; // 1/mol
    private static final double SO2_MOLAR_MASS = 0.064066; // kg/mol

    /** Converts a column in molec/cm2 to kg/m2. */
    public static final double MOLEC_CM2_TO_KG_M2 = 1e4 / AVOGADRO * SO2_MOLAR_MASS;

    private static final double PARALLEL_TOLERANCE = 1e-6;

    @Override
    public FluxEstimate integrate(double[] angles, double[] so2, double[] so2Err, Station station,
            GeoLocation vent, double windSpeed, double plumeAltitude, double plumeAzimuth) {
        if (angles.length == 0) {
            throw new IllegalArgumentException("Cannot integrate an empty scan");
        }
        if (so2.length != angles.length || so2Err.length != angles.length) {
            throw new IllegalArgumentException("Sample arrays differ in length");
        }

        double height = plumeAltitude - station.getElevation();
        if (height <= 0) {
            throw new FluxCalculationException("Plume altitude " + plumeAltitude + " m is not above station "
                    + station.getName() + " (" + station.getElevation() + " m)");
        }

        ScanPlane plane = new ScanPlane(station);
        double crossing = Math.sin(Angle.toRadians(plumeAzimuth - plane.getAzimuth()));
        if (Math.abs(crossing) < PARALLEL_TOLERANCE) {
            throw new FluxCalculationException("Plume direction " + plumeAzimuth
                    + " deg runs parallel to the scan plane of " + station.getName());
        }
        warnIfUpwind(station, plane, vent, plumeAltitude, plumeAzimuth);

        int[] usable = IntStream.range(0, angles.length)
                .filter(i -> plane.looksUpward(angles[i]))
                .boxed()
                .sorted(Comparator.comparingDouble(i -> plane.alongPlanePerMetre(angles[i])))
                .mapToInt(Integer::intValue)
                .toArray();
        if (usable.length < 2) {
            throw new FluxCalculationException("Fewer than two spectra of " + station.getName()
                    + " look upward into the plume");
        }

        double[] x = Arrays.stream(usable).mapToDouble(i -> height * plane.alongPlanePerMetre(angles[i])).toArray();
        double[] vcd = Arrays.stream(usable).mapToDouble(i -> so2[i] * plane.verticalColumnFactor(angles[i])).toArray();
        double[] vcdErr = Arrays.stream(usable)
                .mapToDouble(i -> so2Err[i] * plane.verticalColumnFactor(angles[i]))
                .toArray();

        double column = 0;
        double variance = 0;
        int n = x.length;
        for (int i = 0; i < n; i++) {
            double left = i > 0 ? x[i] - x[i - 1] : 0;
            double right = i < n - 1 ? x[i + 1] - x[i] : 0;
            double weight = 0.5 * (left + right);
            column += weight * vcd[i];
            variance += Math.pow(weight * vcdErr[i], 2);
        }

        double scale = windSpeed * Math.abs(crossing) * MOLEC_CM2_TO_KG_M2;
        return new FluxEstimate(scale * column, scale * Math.sqrt(variance));
    }

    // The plume line leaves the vent along its azimuth; it should cross the scan plane ahead of the vent
    private static void warnIfUpwind(Station station, ScanPlane plane, GeoLocation vent, double plumeAltitude,
            double plumeAzimuth) {
        LocalProjection projection = new LocalProjection(vent);
        Coordinate s = projection.toLocal(station.getPosition());
        Vector2D offset = plane.offsetPerMetre(0).multiply(plumeAltitude - station.getElevation());
        Vector2D origin = Vector2D.create(s.x, s.y).add(offset);

        double az = Angle.toRadians(plumeAzimuth);
        Vector2D plumeDir = Vector2D.create(Math.sin(az), Math.cos(az));
        Vector2D planeDir = plane.getDirection();

        // Solve origin + t * planeDir = d * plumeDir for the distance d along the plume
        double denom = plumeDir.getX() * planeDir.getY() - plumeDir.getY() * planeDir.getX();
        double d = (origin.getX() * planeDir.getY() - origin.getY() * planeDir.getX()) / denom;
        if (d < 0) {
            logger.warn("Plume heading {} deg from the vent does not cross the scan plane of {} downwind",
                    plumeAzimuth, station.getName());
        }
    }
}
