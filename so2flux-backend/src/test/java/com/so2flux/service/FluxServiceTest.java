package com.so2flux.service;

import com.so2flux.config.FluxProperties;
import com.so2flux.model.FluxRecord;
import com.so2flux.model.FluxTable;
import com.so2flux.model.Station;
import com.so2flux.repository.FluxTableRepository;
import com.so2flux.repository.ScanFileRepository;
import com.so2flux.repository.StationRepository;
import com.so2flux.service.model.ScanQualityFilter;
import com.so2flux.service.model.StationPairFinder;
import com.so2flux.service.model.impl.TraverseFluxIntegrator;
import com.so2flux.service.model.impl.TriangulationGeometryEstimator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.so2flux.TestFixtures.SCAN_HEADER;
import static com.so2flux.TestFixtures.VENT;
import static com.so2flux.TestFixtures.stationAt;
import static com.so2flux.TestFixtures.writeGaussianScan;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FluxServiceTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 1);

    // Peak angles of stations A and B for a plume heading east at 1000 m
    private static final double PEAK_A = Math.toDegrees(Math.atan(3));
    private static final double PEAK_B = Math.toDegrees(Math.atan(2));

    private static final double DEFAULT_ALTITUDE = 1500;
    private static final double DEFAULT_AZIMUTH = 135;

    @TempDir
    Path resultsRoot;

    private FluxProperties properties;
    private Path dayRoot;

    @BeforeEach
    void setUp() throws IOException {
        properties = new FluxProperties();
        properties.setResultsRoot(resultsRoot.toString());
        properties.setVent(VENT);
        properties.setDefaultAltitude(DEFAULT_ALTITUDE);
        properties.setDefaultAzimuth(DEFAULT_AZIMUTH);
        properties.setWindSpeed(10);
        properties.setScanPairTime(5);
        properties.setStations(new ArrayList<>(List.of(
                stationAt("A", 2000, -3000, 0),
                stationAt("B", 5000, 2000, 180))));

        dayRoot = resultsRoot.resolve(DATE.toString());
        Files.createDirectories(dayRoot.resolve("A"));
        Files.createDirectories(dayRoot.resolve("B"));
    }

    private FluxService service() {
        return new FluxService(properties, new StationRepository(properties), new ScanCatalogService(),
                new ScanFileRepository(), new FluxTableRepository(), new ScanQualityFilter(properties), new StationPairFinder(),
                new TriangulationGeometryEstimator(properties), new TraverseFluxIntegrator());
    }

    private Path scanFile(String station, String name) {
        return ScanCatalogService.scanDirectory(dayRoot, station).resolve(name);
    }

    private void writePairedScans() throws IOException {
        writeGaussianScan(scanFile("A", "20240301_100000_scan.csv"), PEAK_A);
        writeGaussianScan(scanFile("B", "20240301_100030_scan.csv"), PEAK_B);
    }

    @Test
    void pairsScansOfTwoStationsAndTriangulatesPlume() throws IOException {
        writePairedScans();

        Map<String, FluxTable> tables = service().runDailyAnalysis(DATE, false);

        FluxRecord a = tables.get("A").getRecords().get(0);
        assertThat(a.getTime()).isEqualTo(LocalDateTime.of(2024, 3, 1, 10, 0));
        assertThat(a.getScanFile()).isEqualTo("20240301_100000_scan.csv");
        assertThat(a.getPairStation()).isEqualTo("B");
        assertThat(a.getPairFile()).isEqualTo("20240301_100030_scan.csv");
        assertThat(a.getPlumeAltitude()).isCloseTo(1000, within(0.01));
        assertThat(a.getPlumeDirection()).isCloseTo(90, within(0.01));
        assertThat(a.getWindSpeed()).isEqualTo(10.0);
        assertThat(a.getFlux()).isPositive();
        assertThat(a.getFluxError()).isPositive();

        FluxRecord b = tables.get("B").getRecords().get(0);
        assertThat(b.getPairStation()).isEqualTo("A");
        assertThat(b.getPlumeAltitude()).isCloseTo(1000, within(0.01));
    }

    @Test
    void disabledPairingUsesDefaultGeometry() throws IOException {
        writePairedScans();
        properties.setScanPairFlag(false);

        FluxRecord a = service().runDailyAnalysis(DATE, false).get("A").getRecords().get(0);

        assertThat(a.getScanFile()).isEqualTo("20240301_100000_scan.csv");
        assertThat(a.getPairStation()).isNull();
        assertThat(a.getPairFile()).isNull();
        assertThat(a.getPlumeAltitude()).isEqualTo(DEFAULT_ALTITUDE);
        assertThat(a.getPlumeDirection()).isEqualTo(DEFAULT_AZIMUTH);
        assertThat(a.getFlux()).isPositive();
    }

    @Test
    void nearestScanOutsidePairingWindowIsIgnored() throws IOException {
        writeGaussianScan(scanFile("A", "20240301_100000_scan.csv"), PEAK_A);
        writeGaussianScan(scanFile("B", "20240301_100500_scan.csv"), PEAK_B);

        FluxRecord a = service().calculateFluxes(DATE).get("A").getRecords().get(0);

        assertThat(a.getPairStation()).isNull();
        assertThat(a.getPlumeAltitude()).isEqualTo(DEFAULT_ALTITUDE);
    }

    @Test
    void rejectedPairScanFallsBackToDefaults() throws IOException {
        writeGaussianScan(scanFile("A", "20240301_100000_scan.csv"), PEAK_A);
        Path b = scanFile("B", "20240301_100030_scan.csv");
        Files.createDirectories(b.getParent());
        Files.writeString(b, SCAN_HEADER + "\n");

        FluxRecord a = service().calculateFluxes(DATE).get("A").getRecords().get(0);

        assertThat(a.getPairStation()).isNull();
        assertThat(a.getPlumeAltitude()).isEqualTo(DEFAULT_ALTITUDE);
        assertThat(a.getFlux()).isPositive();
    }

    @Test
    void saturatedScanIsRejected() throws IOException {
        // 8 of 32 spectra above max_int
        StringBuilder csv = new StringBuilder(SCAN_HEADER).append('\n');
        for (int k = -16; k < 16; k++) {
            double intensity = k < -8 ? 70000 : 20000;
            csv.append(PEAK_A + k).append(',').append(5e17 * Math.exp(-Math.pow(k / 5.0, 2)))
                    .append(",1.0E16,").append(intensity).append('\n');
        }
        Path file = scanFile("A", "20240301_100000_scan.csv");
        Files.createDirectories(file.getParent());
        Files.writeString(file, csv.toString());

        FluxRecord a = service().calculateFluxes(DATE).get("A").getRecords().get(0);

        assertThat(a.getTime()).isEqualTo(LocalDateTime.of(2024, 3, 1, 10, 0));
        assertThat(a.getScanFile()).isEqualTo("20240301_100000_scan.csv");
        assertThat(a.getFlux()).isNull();
        assertThat(a.getFluxError()).isNull();
        assertThat(a.getPlumeAltitude()).isNull();
        assertThat(a.getPairStation()).isNull();
    }

    @Test
    void everyScanGetsOneRowInTimeOrder() throws IOException {
        writeGaussianScan(scanFile("A", "20240301_101000_scan.csv"), PEAK_A);
        writeGaussianScan(scanFile("A", "20240301_100000_scan.csv"), PEAK_A);
        Files.writeString(scanFile("A", "20240301_100500_scan.csv"), SCAN_HEADER + "\nabc,1,1,1\n");

        List<FluxRecord> records = service().calculateFluxes(DATE).get("A").getRecords();

        assertThat(records).extracting(FluxRecord::getScanFile).containsExactly(
                "20240301_100000_scan.csv", "20240301_100500_scan.csv", "20240301_101000_scan.csv");
        assertThat(records.get(1).getFlux()).isNull();
        assertThat(records.get(2).getFlux()).isPositive();
    }

    @Test
    void rerunProducesIdenticalFile() throws IOException {
        writePairedScans();
        Path table = FluxTableRepository.tablePath(dayRoot, "A", DATE, false);

        service().runDailyAnalysis(DATE, false);
        byte[] first = Files.readAllBytes(table);
        service().runDailyAnalysis(DATE, false);

        assertThat(Files.readAllBytes(table)).isEqualTo(first);
    }

    @Test
    void exportFailureDoesNotStopOtherStations() throws IOException {
        writePairedScans();
        properties.getStations().add(0, stationAt("C", 0, 5000, 90));

        Map<String, FluxTable> tables = service().runDailyAnalysis(DATE, false);

        assertThat(tables).containsOnlyKeys("C", "A", "B");
        assertThat(tables.get("C").size()).isZero();
        assertThat(Files.exists(dayRoot.resolve("C"))).isFalse();
        assertThat(FluxTableRepository.tablePath(dayRoot, "A", DATE, false)).exists();
        assertThat(FluxTableRepository.tablePath(dayRoot, "B", DATE, false)).exists();
    }

    @Test
    void reanalysisWritesReanalysedTables() throws IOException {
        writePairedScans();

        service().runDailyAnalysis(DATE, true);

        assertThat(FluxTableRepository.tablePath(dayRoot, "A", DATE, true)).exists();
        assertThat(FluxTableRepository.tablePath(dayRoot, "A", DATE, false)).doesNotExist();
    }

    @Test
    void calculateFluxesWritesNothing() throws IOException {
        writePairedScans();

        service().calculateFluxes(DATE);

        assertThat(FluxTableRepository.tablePath(dayRoot, "A", DATE, false)).doesNotExist();
    }

    @Test
    void disabledStationIsSkippedEntirely() throws IOException {
        writePairedScans();
        Station b = properties.getStations().get(1);
        b.setAnalysisEnabled(false);

        Map<String, FluxTable> tables = service().runDailyAnalysis(DATE, false);

        assertThat(tables).containsOnlyKeys("A");
        assertThat(tables.get("A").getRecords().get(0).getPairStation()).isNull();
        assertThat(FluxTableRepository.tablePath(dayRoot, "B", DATE, false)).doesNotExist();
    }

    @Test
    void missingDayDirectoryGivesEmptyTables() {
        Map<String, FluxTable> tables = service().calculateFluxes(LocalDate.of(2024, 3, 2));

        assertThat(tables.get("A").size()).isZero();
        assertThat(tables.get("B").size()).isZero();
    }

    @Test
    void emptySo2CellsCountAsRejectedSpectra() throws IOException {
        // 12 of 30 spectra have no SO2 value
        StringBuilder csv = new StringBuilder(SCAN_HEADER).append('\n');
        for (int k = -15; k < 15; k++) {
            String so2 = k < -3 ? "" : String.valueOf(5e17 * Math.exp(-Math.pow(k / 5.0, 2)));
            csv.append(PEAK_A + k).append(',').append(so2).append(",1.0E16,20000.0\n");
        }
        Path file = scanFile("A", "20240301_100000_scan.csv");
        Files.createDirectories(file.getParent());
        Files.writeString(file, csv.toString());

        FluxRecord a = service().calculateFluxes(DATE).get("A").getRecords().get(0);

        assertThat(a.getScanFile()).isEqualTo("20240301_100000_scan.csv");
        assertThat(a.getFlux()).isNull();
        assertThat(a.getPlumeAltitude()).isNull();
    }

    @Test
    void scanMissingRequiredColumnGetsEmptyRow() throws IOException {
        Path file = scanFile("A", "20240301_100000_scan.csv");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "angle,SO2,SO2_err\n10.0,5.0E17,1.0E16\n");

        List<FluxRecord> records = service().calculateFluxes(DATE).get("A").getRecords();

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getFlux()).isNull();
    }

    @Test
    void unlistableScanDirectoryAbortsRun() throws IOException {
        Files.writeString(ScanCatalogService.scanDirectory(dayRoot, "A"), "not a directory");

        assertThatThrownBy(() -> service().runDailyAnalysis(DATE, false))
                .isInstanceOf(ScanCatalogException.class);
        assertThat(FluxTableRepository.tablePath(dayRoot, "B", DATE, false)).doesNotExist();
    }
}
