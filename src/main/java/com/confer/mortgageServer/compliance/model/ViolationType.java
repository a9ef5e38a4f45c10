package com.confer.mortgageServer.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ViolationType {

    ZERO_TOLERANCE("zero_tolerance"),
    TEN_PERCENT_TOLERANCE("10_percent_tolerance"),
    APR_ACCURACY("apr_accuracy");

    private final String code;

    ViolationType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
