package com.confer.mortgageServer.ingestion.exception;

import com.confer.mortgageServer.common.exception.ErrorKind;
import com.confer.mortgageServer.common.exception.MortgageServerException;

/**
 * Exception thrown when downloaded bytes are too large or are not a PDF.
 */
public class FormatViolationException extends MortgageServerException {

    public enum Reason {
        PAYLOAD_TOO_LARGE,
        NOT_A_PDF
    }

    private final Reason reason;

    public FormatViolationException(Reason reason, String message) {
        super(ErrorKind.FORMAT_VIOLATION, message);
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
