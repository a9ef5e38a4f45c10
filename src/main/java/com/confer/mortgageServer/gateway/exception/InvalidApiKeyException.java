package com.confer.mortgageServer.gateway.exception;

/**
 * Exception thrown when the X-API-Key header is missing or does not match the configured key.
 */
public class InvalidApiKeyException extends RuntimeException {

    public InvalidApiKeyException(String message) {
        super(message);
    }
}
