package com.craftcatalogue.exception;

/**
 * A spreadsheet or report file could not be read or written.
 */
public class CatalogueFileException extends RuntimeException {

    public CatalogueFileException(String message) {
        super(message);
    }

    public CatalogueFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
