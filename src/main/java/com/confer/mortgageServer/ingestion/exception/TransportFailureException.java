package com.confer.mortgageServer.ingestion.exception;

import com.confer.mortgageServer.common.exception.ErrorKind;
import com.confer.mortgageServer.common.exception.MortgageServerException;

/**
 * Exception thrown when a fetch times out or fails at the HTTP level.
 * The caller decides whether to retry.
 */
public class TransportFailureException extends MortgageServerException {

    public TransportFailureException(String message) {
        super(ErrorKind.TRANSPORT_FAILURE, message);
    }

    public TransportFailureException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT_FAILURE, message, cause);
    }
}
