package com.so2flux.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDateTime;

/**
 * One row of a station's daily flux table. Every cataloged scan gets a row; numeric fields
 * of rejected scans are null.
 */
@JsonPropertyOrder({
        FluxRecord.TIME, FluxRecord.SCAN_FILE, FluxRecord.PAIR_STATION, FluxRecord.PAIR_FILE,
        FluxRecord.FLUX, FluxRecord.FLUX_ERR, FluxRecord.PLUME_ALTITUDE, FluxRecord.PLUME_DIRECTION,
        FluxRecord.WIND_SPEED })
public class FluxRecord {

    public static final String TIME = "Time [UTC]";
    public static final String SCAN_FILE = "Scan File";
    public static final String PAIR_STATION = "Pair Station";
    public static final String PAIR_FILE = "Pair File";
    public static final String FLUX = "Flux [kg/s]";
    public static final String FLUX_ERR = "Flux Err [kg/s]";
    public static final String PLUME_ALTITUDE = "Plume Altitude [m]";
    public static final String PLUME_DIRECTION = "Plume Direction [deg]";
    public static final String WIND_SPEED = "Wind Speed [m/s]";

    @JsonProperty(TIME)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime time;

    @JsonProperty(SCAN_FILE)
    private String scanFile;

    @JsonProperty(PAIR_STATION)
    private String pairStation;

    @JsonProperty(PAIR_FILE)
    private String pairFile;

    @JsonProperty(FLUX)
    private Double flux;

    @JsonProperty(FLUX_ERR)
    private Double fluxError;

    @JsonProperty(PLUME_ALTITUDE)
    private Double plumeAltitude;

    @JsonProperty(PLUME_DIRECTION)
    private Double plumeDirection;

    @JsonProperty(WIND_SPEED)
    private Double windSpeed;

    public FluxRecord() {
        // Default constructor for Jackson
    }

    /** A row for a scan that did not pass the quality gate. */
    public static FluxRecord rejected(LocalDateTime time, String scanFile) {
        FluxRecord record = new FluxRecord();
        record.setTime(time);
        record.setScanFile(scanFile);
        return record;
    }

    public LocalDateTime getTime() {
        return time;
    }

    public void setTime(LocalDateTime time) {
        this.time = time;
    }

    public String getScanFile() {
        return scanFile;
    }

    public void setScanFile(String scanFile) {
        this.scanFile = scanFile;
    }

    public String getPairStation() {
        return pairStation;
    }

    public void setPairStation(String pairStation) {
        this.pairStation = pairStation;
    }

    public String getPairFile() {
        return pairFile;
    }

    public void setPairFile(String pairFile) {
        this.pairFile = pairFile;
    }

    public Double getFlux() {
        return flux;
    }

    public void setFlux(Double flux) {
        this.flux = flux;
    }

    public Double getFluxError() {
        return fluxError;
    }

    public void setFluxError(Double fluxError) {
        this.fluxError = fluxError;
    }

    public Double getPlumeAltitude() {
        return plumeAltitude;
    }

    public void setPlumeAltitude(Double plumeAltitude) {
        this.plumeAltitude = plumeAltitude;
    }

    public Double getPlumeDirection() {
        return plumeDirection;
    }

    public void setPlumeDirection(Double plumeDirection) {
        this.plumeDirection = plumeDirection;
    }

    public Double getWindSpeed() {
        return windSpeed;
    }

    public void setWindSpeed(Double windSpeed) {
        this.windSpeed = windSpeed;
    }

    @Override
    public String toString() {
        return "FluxRecord{" +
                "time=" + time +
                ", scanFile='" + scanFile + '\'' +
                ", pairStation='" + pairStation + '\'' +
                ", pairFile='" + pairFile + '\'' +
                ", flux=" + flux +
                ", fluxError=" + fluxError +
                ", plumeAltitude=" + plumeAltitude +
                ", plumeDirection=" + plumeDirection +
                ", windSpeed=" + windSpeed +
                '}';
    }
}
