package com.order.consolidation.catalog;

/**
 * Thrown when a catalog document cannot be read at all.
 */
public class CatalogImportException extends RuntimeException {

    public CatalogImportException(String message) {
        super(message);
    }

    public CatalogImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
