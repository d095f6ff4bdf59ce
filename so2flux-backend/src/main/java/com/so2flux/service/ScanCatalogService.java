package com.so2flux.service;

import com.so2flux.model.ScanCatalog;
import com.so2flux.model.ScanFile;
import com.so2flux.model.Station;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Enumerates the scan files of each station for one day.
 */
@Service
public class ScanCatalogService {

    private static final Logger logger = LoggerFactory.getLogger(ScanCatalogService.class);

    /** Scan files of a station live in {@code <dayRoot>/<station>/so2}. */
    public static final String SCAN_SUBDIRECTORY = "so2";

    private static final DateTimeFormatter SEPARATED_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter COMPACT_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    /**
     * Builds a snapshot of the scans available under {@code dayRoot}. A station without a
     * scan directory gets an empty list.
     *
     * @throws ScanCatalogException if a scan directory cannot be listed for any reason other
     *                              than its absence, such as denied access or a file in its place
     */
    public ScanCatalog catalog(List<Station> stations, Path dayRoot) {
        ScanCatalog catalog = new ScanCatalog();
        for (Station station : stations) {
            catalog.put(station.getName(), listScans(station.getName(), dayRoot));
        }
        logger.debug("Cataloged {} scans from {} stations under {}", catalog.totalScans(), stations.size(), dayRoot);
        return catalog;
    }

    public static Path scanDirectory(Path dayRoot, String stationName) {
        return dayRoot.resolve(stationName).resolve(SCAN_SUBDIRECTORY);
    }

    private List<ScanFile> listScans(String stationName, Path dayRoot) {
        Path dir = scanDirectory(dayRoot, stationName);

        List<ScanFile> scans = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(Files::isRegularFile).forEach(path -> {
                Optional<LocalDateTime> timestamp = parseTimestamp(path.getFileName().toString());
                if (timestamp.isPresent()) {
                    scans.add(new ScanFile(stationName, path, timestamp.get()));
                } else {
                    logger.warn("Skipping {}: file name does not start with a scan timestamp", path);
                }
            });
        } catch (NoSuchFileException e) {
            logger.info("No scan directory for station {} at {}", stationName, dir);
            return List.of();
        } catch (IOException | UncheckedIOException e) {
            throw new ScanCatalogException("Failed to list scans of station " + stationName + " in " + dir, e);
        }

        scans.sort(Comparator.comparing(ScanFile::getTimestamp).thenComparing(ScanFile::getFileName));
        return scans;
    }

    /**
     * Parses the scan start time from the leading characters of a file name, either
     * {@code yyyyMMdd_HHmmss} or {@code yyyyMMddHHmmss}.
     */
    public static Optional<LocalDateTime> parseTimestamp(String fileName) {
        try {
            if (fileName.length() >= 15 && fileName.charAt(8) == '_') {
                return Optional.of(LocalDateTime.parse(fileName.substring(0, 15), SEPARATED_FORMAT));
            }
            if (fileName.length() >= 14) {
                return Optional.of(LocalDateTime.parse(fileName.substring(0, 14), COMPACT_FORMAT));
            }
        } catch (DateTimeParseException e) {
            logger.debug("Cannot parse timestamp of {}: {}", fileName, e.getMessage());
        }
        return Optional.empty();
    }
}
