package com.confer.mortgageServer.common.exception;

/**
 * Base exception for every failure that aborts a tool operation.
 * Carries the {@link ErrorKind} reported to the caller.
 */
public abstract class MortgageServerException extends RuntimeException {

    private final ErrorKind kind;

    protected MortgageServerException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected MortgageServerException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Finer-grained reason within the kind, or null when the kind says it all.
     */
    public String getReason() {
        return null;
    }
}
