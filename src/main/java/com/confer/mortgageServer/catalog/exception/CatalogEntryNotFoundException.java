package com.confer.mortgageServer.catalog.exception;

/**
 * Exception thrown when a resource URI or prompt name is not in the catalog.
 */
public class CatalogEntryNotFoundException extends RuntimeException {

    public CatalogEntryNotFoundException(String message) {
        super(message);
    }
}
