package com.so2flux.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of a scan result file. Columns other than the four used by the flux retrieval
 * are ignored; empty cells are read as null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanSample {

    public static final String ANGLE = "angle";
    public static final String SO2 = "SO2";
    public static final String SO2_ERR = "SO2_err";
    public static final String INTENSITY = "int_av";

    @JsonProperty(ANGLE)
    private Double angle;

    @JsonProperty(SO2)
    private Double so2;

    @JsonProperty(SO2_ERR)
    private Double so2Err;

    @JsonProperty(INTENSITY)
    private Double intensity;

    public ScanSample() {
        // Default constructor for Jackson
    }

    public Double getAngle() {
        return angle;
    }

    public void setAngle(Double angle) {
        this.angle = angle;
    }

    public Double getSo2() {
        return so2;
    }

    public void setSo2(Double so2) {
        this.so2 = so2;
    }

    public Double getSo2Err() {
        return so2Err;
    }

    public void setSo2Err(Double so2Err) {
        this.so2Err = so2Err;
    }

    public Double getIntensity() {
        return intensity;
    }

    public void setIntensity(Double intensity) {
        this.intensity = intensity;
    }
}
