package com.so2flux.repository;

import com.so2flux.config.FluxProperties;
import com.so2flux.model.Station;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Station registry backed by the {@code flux.stations} configuration. Iteration order is
 * the configured order.
 */
@Repository
public class StationRepository {

    private final Map<String, Station> stations = new LinkedHashMap<>();

    @Autowired
    public StationRepository(FluxProperties properties) {
        this(properties.getStations());
    }

    public StationRepository(List<Station> stations) {
        for (Station station : stations) {
            if (station.getName() == null || station.getName().isBlank()) {
                throw new IllegalArgumentException("Station name is required: " + station);
            }
            if (this.stations.putIfAbsent(station.getName(), station) != null) {
                throw new IllegalArgumentException("Duplicate station name: " + station.getName());
            }
        }
    }

    public List<Station> findAll() {
        return List.copyOf(stations.values());
    }

    public List<Station> findAnalysisEnabled() {
        return stations.values().stream()
                .filter(Station::isAnalysisEnabled)
                .collect(Collectors.toList());
    }

    public Optional<Station> findByName(String name) {
        return Optional.ofNullable(stations.get(name));
    }
}
