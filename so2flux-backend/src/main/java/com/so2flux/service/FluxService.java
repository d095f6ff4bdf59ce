package com.so2flux.service;

import com.so2flux.config.FluxProperties;
import com.so2flux.model.FilteredScan;
import com.so2flux.model.FluxEstimate;
import com.so2flux.model.FluxRecord;
import com.so2flux.model.FluxTable;
import com.so2flux.model.PairedObservation;
import com.so2flux.model.PlumeGeometry;
import com.so2flux.model.ScanCatalog;
import com.so2flux.model.ScanFile;
import com.so2flux.model.ScanRecord;
import com.so2flux.model.Station;
import com.so2flux.repository.FluxTableRepository;
import com.so2flux.repository.ScanFileRepository;
import com.so2flux.repository.StationRepository;
import com.so2flux.service.model.FluxCalculationException;
import com.so2flux.service.model.FluxIntegrator;
import com.so2flux.service.model.PlumeGeometryEstimator;
import com.so2flux.service.model.ScanQualityFilter;
import com.so2flux.service.model.StationPairFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Computes the daily flux tables of all stations: every cataloged scan is filtered, paired
 * with the nearest scan of another station, given a plume geometry and integrated into a
 * flux. Each station's table has exactly one row per scan.
 */
@Service
public class FluxService {

    private static final Logger logger = LoggerFactory.getLogger(FluxService.class);

    private final FluxProperties properties;
    private final StationRepository stationRepository;
    private final ScanCatalogService catalogService;
    private final ScanFileRepository scanFileRepository;
    private final FluxTableRepository fluxTableRepository;
    private final ScanQualityFilter qualityFilter;
    private final StationPairFinder pairFinder;
    private final PlumeGeometryEstimator geometryEstimator;
    private final FluxIntegrator fluxIntegrator;

    @Autowired
    public FluxService(
            FluxProperties properties,
            StationRepository stationRepository,
            ScanCatalogService catalogService,
            ScanFileRepository scanFileRepository,
            FluxTableRepository fluxTableRepository,
            ScanQualityFilter qualityFilter,
            StationPairFinder pairFinder,
            PlumeGeometryEstimator geometryEstimator,
            FluxIntegrator fluxIntegrator) {
        this.properties = properties;
        this.stationRepository = stationRepository;
        this.catalogService = catalogService;
        this.scanFileRepository = scanFileRepository;
        this.fluxTableRepository = fluxTableRepository;
        this.qualityFilter = qualityFilter;
        this.pairFinder = pairFinder;
        this.geometryEstimator = geometryEstimator;
        this.fluxIntegrator = fluxIntegrator;
    }

    public Path dayRoot(LocalDate date) {
        return Paths.get(properties.getResultsRoot()).resolve(date.toString());
    }

    /**
     * Calculates and writes the flux tables of every station for the given day. A table that
     * cannot be written is logged and skipped.
     *
     * @param reanalysis write the {@code _reanalysed} variant of the tables
     * @return the tables by station name, in registry order
     * @throws ScanCatalogException if the day's scans cannot be enumerated
     */
    public Map<String, FluxTable> runDailyAnalysis(LocalDate date, boolean reanalysis) {
        Path dayRoot = dayRoot(date);
        return process(date, table -> export(table, dayRoot, reanalysis));
    }

    /**
     * Calculates the flux tables of every station for the given day without writing them.
     *
     * @throws ScanCatalogException if the day's scans cannot be enumerated
     */
    public Map<String, FluxTable> calculateFluxes(LocalDate date) {
        return process(date, table -> {
        });
    }

    private Map<String, FluxTable> process(LocalDate date, Consumer<FluxTable> sink) {
        List<Station> stations = stationRepository.findAnalysisEnabled();
        ScanCatalog catalog = catalogService.catalog(stations, dayRoot(date));

        // Each scan file is read and filtered at most once per run
        Map<ScanFile, FilteredScan> filtered = new HashMap<>();

        Map<String, FluxTable> tables = new LinkedHashMap<>();
        for (Station station : stations) {
            logger.info("Calculating fluxes for {}", station.getName());
            FluxTable table = calculateStationFluxes(station, date, catalog, filtered);
            tables.put(station.getName(), table);
            sink.accept(table);
        }
        return tables;
    }

    private FluxTable calculateStationFluxes(Station station, LocalDate date, ScanCatalog catalog,
            Map<ScanFile, FilteredScan> filtered) {
        List<FluxRecord> records = new ArrayList<>();

        for (ScanFile scan : catalog.getScans(station.getName())) {
            FilteredScan filteredScan = filter(scan, filtered);
            if (!filteredScan.isAnalyzable()) {
                logger.info("Scan {} not analysed. {}", scan.getFileName(), filteredScan.getVerdict().getDescription());
                records.add(FluxRecord.rejected(scan.getTimestamp(), scan.getFileName()));
                continue;
            }

            PairedObservation observation = resolveGeometry(station, scan, filteredScan, catalog, filtered);
            records.add(buildRecord(station, scan, filteredScan, observation));
        }

        return new FluxTable(station.getName(), date, records);
    }

    private PairedObservation resolveGeometry(Station station, ScanFile scan, FilteredScan filteredScan,
            ScanCatalog catalog, Map<ScanFile, FilteredScan> filtered) {
        PairedObservation unpaired = PairedObservation.unpaired(
                PlumeGeometry.defaults(properties.getDefaultAltitude(), properties.getDefaultAzimuth()));

        if (!properties.isScanPairFlag()) {
            return unpaired;
        }

        Optional<ScanFile> nearest = pairFinder.findNearest(station.getName(), scan.getTimestamp(), catalog);
        if (nearest.isEmpty()) {
            logger.debug("No scan from another station to pair with {}", scan);
            return unpaired;
        }

        ScanFile pairScan = nearest.get();
        Duration delta = StationPairFinder.timeDelta(scan.getTimestamp(), pairScan.getTimestamp());
        if (delta.compareTo(properties.getScanPairWindow()) >= 0) {
            logger.debug("Nearest scan {} is {} s from {}, outside the pairing window", pairScan,
                    delta.getSeconds(), scan);
            return unpaired;
        }

        FilteredScan pairFiltered = filter(pairScan, filtered);
        if (!pairFiltered.isAnalyzable()) {
            logger.info("Pair scan {} for {} not usable ({}), using default geometry", pairScan, scan.getFileName(),
                    pairFiltered.getVerdict().getDescription());
            return unpaired;
        }

        Station pairStation = stationRepository.findByName(pairScan.getStationName())
                .orElseThrow(() -> new IllegalStateException("Unknown station " + pairScan.getStationName()));
        PlumeGeometry geometry = geometryEstimator.estimate(
                filteredScan.getPeakAngle(), pairFiltered.getPeakAngle(),
                station, pairStation, properties.getVent(), properties.getDefaultAltitude());
        return PairedObservation.paired(pairScan, geometry);
    }

    private FluxRecord buildRecord(Station station, ScanFile scan, FilteredScan filteredScan,
            PairedObservation observation) {
        PlumeGeometry geometry = observation.getGeometry();

        FluxRecord record = new FluxRecord();
        record.setTime(scan.getTimestamp());
        record.setScanFile(scan.getFileName());
        observation.getPairScan().ifPresent(pair -> {
            record.setPairStation(pair.getStationName());
            record.setPairFile(pair.getFileName());
        });
        record.setPlumeAltitude(geometry.getAltitude());
        record.setPlumeDirection(geometry.getAzimuth());
        record.setWindSpeed(properties.getWindSpeed());

        try {
            FluxEstimate estimate = fluxIntegrator.integrate(
                    filteredScan.getKeptAngles(), filteredScan.getKeptSo2(), filteredScan.getKeptSo2Err(),
                    station, properties.getVent(), properties.getWindSpeed(),
                    geometry.getAltitude(), geometry.getAzimuth());
            record.setFlux(estimate.getFlux());
            record.setFluxError(estimate.getFluxError());
        } catch (FluxCalculationException e) {
            logger.warn("Flux of scan {} not calculated: {}", scan, e.getMessage());
        }
        return record;
    }

    private FilteredScan filter(ScanFile scan, Map<ScanFile, FilteredScan> filtered) {
        FilteredScan cached = filtered.get(scan);
        if (cached != null) {
            return cached;
        }

        FilteredScan result;
        try {
            ScanRecord record = scanFileRepository.read(scan);
            result = qualityFilter.filter(record);
        } catch (IOException e) {
            logger.warn("Failed to read scan {}: {}", scan, e.getMessage());
            result = FilteredScan.unreadable(scan.getFileName());
        }
        filtered.put(scan, result);
        return result;
    }

    private void export(FluxTable table, Path dayRoot, boolean reanalysis) {
        try {
            Path path = fluxTableRepository.save(table, dayRoot, reanalysis);
            logger.info("Wrote {} flux rows for {} to {}", table.size(), table.getStationName(), path);
        } catch (IOException e) {
            logger.warn("Failed to write flux table of {}: {}", table.getStationName(), e.toString());
        }
    }
}
