package com.confer.mortgageServer.common.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine-readable failure categories surfaced to callers.
 * None of them is retried by the server.
 */
public enum ErrorKind {

    /** Malformed or out-of-range document fields or tool arguments. */
    SCHEMA_VIOLATION("SchemaViolation"),

    /** Document reference rejected by static URL validation, before any network I/O. */
    SECURITY_VIOLATION("SecurityViolation"),

    /** Downloaded bytes too large or not a PDF. */
    FORMAT_VIOLATION("FormatViolation"),

    /** Network timeout or HTTP-level failure during a fetch. */
    TRANSPORT_FAILURE("TransportFailure"),

    /** Operation name with no registered handler. */
    UNKNOWN_OPERATION("UnknownOperation");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
