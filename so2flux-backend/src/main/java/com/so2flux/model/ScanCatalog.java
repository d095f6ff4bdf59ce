package com.so2flux.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time snapshot of the scan files available for one day, per station. Station
 * iteration order is the registry order and each station's scans are ordered by timestamp.
 */
public class ScanCatalog {

    private final Map<String, List<ScanFile>> scansByStation = new LinkedHashMap<>();

    public void put(String stationName, List<ScanFile> scans) {
        scansByStation.put(stationName, List.copyOf(scans));
    }

    /**
     * @return the station's scans, or an empty list if the station has none or is unknown
     */
    public List<ScanFile> getScans(String stationName) {
        return scansByStation.getOrDefault(stationName, Collections.emptyList());
    }

    public Set<String> getStationNames() {
        return Collections.unmodifiableSet(scansByStation.keySet());
    }

    public int totalScans() {
        return scansByStation.values().stream().mapToInt(List::size).sum();
    }
}
