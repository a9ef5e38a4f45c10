package com.confer.mortgageServer.ingestion.exception;

import com.confer.mortgageServer.common.exception.ErrorKind;
import com.confer.mortgageServer.common.exception.MortgageServerException;

/**
 * Exception thrown when a document reference fails static validation.
 * Always raised before any network access.
 */
public class SecurityViolationException extends MortgageServerException {

    public enum Reason {
        MALFORMED_URL,
        SCHEME_NOT_ALLOWED,
        DOMAIN_NOT_ALLOWED,
        EXTENSION_NOT_ALLOWED
    }

    private final Reason reason;

    public SecurityViolationException(Reason reason, String message) {
        super(ErrorKind.SECURITY_VIOLATION, message);
        this.reason = reason;
    }

    public Reason getViolation() {
        return reason;
    }

    @Override
    public String getReason() {
        return reason.name();
    }
}
