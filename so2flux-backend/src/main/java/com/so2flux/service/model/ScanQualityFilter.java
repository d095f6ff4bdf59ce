package com.so2flux.service.model;

import com.so2flux.config.FilterSettings;
import com.so2flux.config.FluxProperties;
import com.so2flux.model.FilteredScan;
import com.so2flux.model.ScanRecord;
import com.so2flux.model.ScanVerdict;
import com.so2flux.service.model.impl.smoothing.SavitzkyGolaySmoother;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Quality gate for a single scan: bounds the SO2 and intensity of each spectrum, checks
 * that enough spectra are good and enough of them see the plume, then finds the plume
 * centre as the angle of the maximum smoothed SO2 column.
 */
@Component
public class ScanQualityFilter {

    /** Minimum number of kept spectra above the plume threshold. */
    public static final int MIN_PLUME_SPECTRA = 10;

    private final FilterSettings settings;
    private final SavitzkyGolaySmoother smoother;

    @Autowired
    public ScanQualityFilter(FluxProperties properties) {
        this(properties.getFilter());
    }

    /**
     * @throws IllegalArgumentException if the smoothing window is not odd or not above the
     *                                  polynomial order
     */
    public ScanQualityFilter(FilterSettings settings) {
        this.settings = settings;
        this.smoother = new SavitzkyGolaySmoother(settings.getSmoothingWindow(), settings.getSmoothingOrder());
    }

    public FilteredScan filter(ScanRecord scan) {
        int n = scan.size();
        boolean[] keep = new boolean[n];
        if (n == 0) {
            return FilteredScan.rejected(scan, keep, ScanVerdict.REJECTED_LOW_SIGNAL);
        }

        int rejected = 0;
        for (int i = 0; i < n; i++) {
            keep[i] = withinBounds(scan, i);
            if (!keep[i]) rejected++;
        }
        // A scan without any kept spectrum is rejected even when goodScanLim allows it
        if (rejected > settings.getGoodScanLim() * n || rejected == n) {
            return FilteredScan.rejected(scan, keep, ScanVerdict.REJECTED_LOW_SIGNAL);
        }

        int nplume = 0;
        for (int i = 0; i < n; i++) {
            if (keep[i] && scan.getSo2(i) > settings.getPlumeScd()) nplume++;
        }
        if (nplume < MIN_PLUME_SPECTRA) {
            return FilteredScan.rejected(scan, keep, ScanVerdict.REJECTED_INSUFFICIENT_PLUME);
        }

        // Kept spectra ordered by angle; the sort is stable for equal angles
        int[] order = IntStream.range(0, n)
                .filter(i -> keep[i])
                .boxed()
                .sorted(Comparator.comparingDouble(scan::getAngle))
                .mapToInt(Integer::intValue)
                .toArray();

        double[] so2 = Arrays.stream(order).mapToDouble(scan::getSo2).toArray();
        double[] smoothed = smoother.smooth(so2);

        int peak = 0;
        for (int i = 1; i < smoothed.length; i++) {
            if (smoothed[i] > smoothed[peak]) peak = i;
        }
        return FilteredScan.analyzable(scan, keep, scan.getAngle(order[peak]));
    }

    // NaN fails every comparison and is therefore rejected
    private boolean withinBounds(ScanRecord scan, int i) {
        if (Double.isNaN(scan.getAngle(i))) {
            return false;
        }
        double so2 = scan.getSo2(i);
        double intensity = scan.getIntensity(i);
        return so2 >= settings.getMinScd() && so2 <= settings.getMaxScd()
                && intensity >= settings.getMinInt() && intensity <= settings.getMaxInt();
    }
}
