package com.example.zipcatalog.store;

/**
 * Raised when the backing database rejects or fails an operation.
 */
public class CatalogStoreException extends RuntimeException {

    public CatalogStoreException(String message) {
        super(message);
    }

    public CatalogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
