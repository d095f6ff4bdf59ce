package com.so2flux.service;

/**
 * The day's scan directories could not be enumerated. Unlike a missing station directory,
 * this aborts the whole run.
 */
public class ScanCatalogException extends RuntimeException {

    public ScanCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
