package com.so2flux.model;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A scan file found in a station's results directory, with the start time parsed from its
 * name.
 */
public class ScanFile {

    private final String stationName;
    private final Path path;
    private final LocalDateTime timestamp;

    public ScanFile(String stationName, Path path, LocalDateTime timestamp) {
        this.stationName = Objects.requireNonNull(stationName, "stationName");
        this.path = Objects.requireNonNull(path, "path");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public String getStationName() {
        return stationName;
    }

    public Path getPath() {
        return path;
    }

    public String getFileName() {
        return path.getFileName().toString();
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScanFile)) return false;
        ScanFile scanFile = (ScanFile) o;
        return stationName.equals(scanFile.stationName) && path.equals(scanFile.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stationName, path);
    }

    @Override
    public String toString() {
        return stationName + "/" + getFileName();
    }
}
