package com.chainwright.core.catalog;

/**
 * Thrown when the chain catalog cannot be loaded or is internally inconsistent.
 */
public class CatalogException extends RuntimeException {
    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
