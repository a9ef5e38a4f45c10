package com.confer.mortgageServer.gateway.exception;

/**
 * Exception thrown when a client exceeds its per-minute request allowance.
 */
public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException(String message) {
        super(message);
    }
}
