package com.so2flux.model;

import java.time.LocalDate;
import java.util.List;

/**
 * The flux rows of one station for one day, in scan order.
 */
public class FluxTable {

    private final String stationName;
    private final LocalDate date;
    private final List<FluxRecord> records;

    public FluxTable(String stationName, LocalDate date, List<FluxRecord> records) {
        this.stationName = stationName;
        this.date = date;
        this.records = List.copyOf(records);
    }

    public String getStationName() {
        return stationName;
    }

    public LocalDate getDate() {
        return date;
    }

    public List<FluxRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }
}
