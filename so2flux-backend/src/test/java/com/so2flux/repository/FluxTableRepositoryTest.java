package com.so2flux.repository;

import com.so2flux.model.FluxRecord;
import com.so2flux.model.FluxTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FluxTableRepositoryTest {

    private static final LocalDate DATE = LocalDate.of(2024, 3, 1);

    private final FluxTableRepository repository = new FluxTableRepository();

    @TempDir
    Path dayRoot;

    private static FluxTable table() {
        FluxRecord rejected = FluxRecord.rejected(LocalDateTime.of(2024, 3, 1, 10, 0), "20240301_100000_scan.csv");

        FluxRecord record = new FluxRecord();
        record.setTime(LocalDateTime.of(2024, 3, 1, 10, 5, 30));
        record.setScanFile("20240301_100530_scan.csv");
        record.setPairStation("B");
        record.setPairFile("20240301_100600_scan.csv");
        record.setFlux(12.5);
        record.setFluxError(1.5);
        record.setPlumeAltitude(1000.0);
        record.setPlumeDirection(90.0);
        record.setWindSpeed(10.0);

        return new FluxTable("A", DATE, List.of(rejected, record));
    }

    // Cells with spaces may be quoted; compare the unquoted text
    private static List<String> unquotedLines(Path path) throws IOException {
        return Files.readAllLines(path).stream().map(line -> line.replace("\"", "")).collect(Collectors.toList());
    }

    @Test
    void writesHeaderAndOneLinePerRecord() throws IOException {
        Files.createDirectories(dayRoot.resolve("A"));

        Path path = repository.save(table(), dayRoot, false);

        assertThat(path).isEqualTo(dayRoot.resolve("A").resolve("2024-03-01_A_fluxes.csv"));
        assertThat(unquotedLines(path)).containsExactly(
                "Time [UTC],Scan File,Pair Station,Pair File,Flux [kg/s],Flux Err [kg/s],Plume Altitude [m],"
                        + "Plume Direction [deg],Wind Speed [m/s]",
                "2024-03-01 10:00:00,20240301_100000_scan.csv,,,,,,,",
                "2024-03-01 10:05:30,20240301_100530_scan.csv,B,20240301_100600_scan.csv,12.5,1.5,1000.0,90.0,10.0");
    }

    @Test
    void reanalysisWritesSeparateFile() throws IOException {
        Files.createDirectories(dayRoot.resolve("A"));

        Path path = repository.save(table(), dayRoot, true);

        assertThat(path.getFileName().toString()).isEqualTo("2024-03-01_A_fluxes_reanalysed.csv");
        assertThat(Files.exists(dayRoot.resolve("A").resolve("2024-03-01_A_fluxes.csv"))).isFalse();
    }

    @Test
    void overwritesExistingTable() throws IOException {
        Files.createDirectories(dayRoot.resolve("A"));
        Path path = repository.save(table(), dayRoot, false);
        Files.writeString(path, "stale content that is longer than nothing\n".repeat(50));

        repository.save(table(), dayRoot, false);

        assertThat(unquotedLines(path)).hasSize(3);
    }

    @Test
    void doesNotCreateMissingStationDirectory() {
        assertThatThrownBy(() -> repository.save(table(), dayRoot, false)).isInstanceOf(IOException.class);
        assertThat(Files.exists(dayRoot.resolve("A"))).isFalse();
    }
}
