package com.so2flux.service.model;

import com.so2flux.model.ScanCatalog;
import com.so2flux.model.ScanFile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Finds the scan from another station that is closest in time to a given scan.
 */
@Component
public class StationPairFinder {

    /**
     * Searches every other station of the catalog for its scan nearest to {@code scanTime}
     * and returns the nearest of those. Ties go to the candidate met first in catalog order.
     *
     * @param stationName the station the scan belongs to; its own scans are never returned
     * @param scanTime    start time of the scan to pair
     * @param catalog     the day's scan catalog
     * @return the nearest other-station scan, or empty if no other station has scans
     */
    public Optional<ScanFile> findNearest(String stationName, LocalDateTime scanTime, ScanCatalog catalog) {
        ScanFile nearest = null;
        Duration nearestDelta = null;

        for (String name : catalog.getStationNames()) {
            if (name.equals(stationName)) continue;

            List<ScanFile> scans = catalog.getScans(name);
            if (scans.isEmpty()) continue;

            ScanFile stationNearest = null;
            Duration stationDelta = null;
            for (ScanFile candidate : scans) {
                Duration delta = timeDelta(scanTime, candidate.getTimestamp());
                if (stationDelta == null || delta.compareTo(stationDelta) < 0) {
                    stationNearest = candidate;
                    stationDelta = delta;
                }
            }

            if (nearestDelta == null || stationDelta.compareTo(nearestDelta) < 0) {
                nearest = stationNearest;
                nearestDelta = stationDelta;
            }
        }
        return Optional.ofNullable(nearest);
    }

    /** @return the absolute time between two scans */
    public static Duration timeDelta(LocalDateTime a, LocalDateTime b) {
        return Duration.between(a, b).abs();
    }
}
