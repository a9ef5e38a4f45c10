package com.confer.mortgageServer.document.exception;

import com.confer.mortgageServer.common.exception.ErrorKind;
import com.confer.mortgageServer.common.exception.MortgageServerException;

/**
 * Exception thrown when extracted fields or tool arguments fail schema validation.
 */
public class DocumentValidationException extends MortgageServerException {

    private final String field;

    public DocumentValidationException(String field, String message) {
        super(ErrorKind.SCHEMA_VIOLATION, field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
