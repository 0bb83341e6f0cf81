package com.microservices.processor.service;

/**
 * A housing CSV import that could not be read or parsed. Nothing from the import is written.
 */
public class HousingImportException extends RuntimeException {

    public HousingImportException(String message) {
        super(message);
    }

    public HousingImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
