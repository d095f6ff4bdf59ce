package com.so2flux.model;

/**
 * Outcome of the quality gate applied to a single scan.
 */
public enum ScanVerdict {
    ANALYZABLE("Scan analysed"),
    REJECTED_LOW_SIGNAL("Not enough good spectra"),
    REJECTED_INSUFFICIENT_PLUME("Not enough plume spectra"),
    REJECTED_UNREADABLE("Scan file could not be read");

    private final String description;

    ScanVerdict(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
