package com.confer.mortgageServer.tool.exception;

import com.confer.mortgageServer.common.exception.ErrorKind;
import com.confer.mortgageServer.common.exception.MortgageServerException;

/**
 * Exception thrown when a tool name has no registered handler.
 */
public class UnknownOperationException extends MortgageServerException {

    private final String operation;

    public UnknownOperationException(String operation) {
        super(ErrorKind.UNKNOWN_OPERATION, "Unknown tool: " + operation);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
